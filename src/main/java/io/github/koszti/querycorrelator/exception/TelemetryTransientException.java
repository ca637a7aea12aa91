package io.github.koszti.querycorrelator.exception;

import java.util.Objects;

/**
 * Telemetry call failed in a way that is expected to resolve on retry:
 * connection errors, timeouts, 5xx and throttling responses.
 */
public class TelemetryTransientException extends RuntimeException {

    private final String baseUrl;
    private final int statusCode;

    public TelemetryTransientException(String baseUrl, Throwable cause) {
        super("Telemetry API unavailable at " + baseUrl + ": " + cause, cause);
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.statusCode = -1;
    }

    public TelemetryTransientException(String baseUrl, int statusCode, String message) {
        super(message);
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.statusCode = statusCode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * HTTP status, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public CorrelationErrorKind getKind() {
        return CorrelationErrorKind.TELEMETRY_TRANSIENT;
    }
}
