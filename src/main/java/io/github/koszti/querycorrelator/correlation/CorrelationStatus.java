package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.exception.CorrelationErrorKind;

/**
 * How a correlation run ended.
 */
public enum CorrelationStatus {
    CORRELATED(null),
    NO_IDENTIFIER(null),
    EXECUTION_FAILED(CorrelationErrorKind.EXECUTION_FAILED),
    CORRELATION_EXHAUSTED(CorrelationErrorKind.CORRELATION_EXHAUSTED),
    TELEMETRY_FATAL(CorrelationErrorKind.TELEMETRY_FATAL),
    TELEMETRY_UNAVAILABLE(CorrelationErrorKind.TELEMETRY_TRANSIENT),
    DEADLINE_EXCEEDED(CorrelationErrorKind.DEADLINE_EXCEEDED),
    CANCELLED(null);

    private final CorrelationErrorKind errorKind;

    CorrelationStatus(CorrelationErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    /**
     * Error class behind this status, or null when the run did not fail.
     */
    public CorrelationErrorKind errorKind() {
        return errorKind;
    }

    public static CorrelationStatus forError(CorrelationErrorKind kind) {
        for (CorrelationStatus status : values()) {
            if (status.errorKind == kind) {
                return status;
            }
        }
        throw new IllegalArgumentException("No status for " + kind);
    }
}
