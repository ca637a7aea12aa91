package io.github.koszti.querycorrelator.exception;

/**
 * Telemetry call was rejected: authentication failure, malformed request, or any 4xx
 * other than not-found. Retrying will not change the answer.
 */
public class TelemetryFatalException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;

    public TelemetryFatalException(int statusCode, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * API error code such as {@code PERMISSION_DENIED}, may be null.
     */
    public String getErrorCode() {
        return errorCode;
    }

    public CorrelationErrorKind getKind() {
        return CorrelationErrorKind.TELEMETRY_FATAL;
    }
}
