package io.github.koszti.querycorrelator.exception;

/**
 * Failure classes of a correlation run.
 */
public enum CorrelationErrorKind {
    /** The primary channel could not complete the query. */
    EXECUTION_FAILED,
    /** Telemetry call failed in a way that is expected to resolve on retry. */
    TELEMETRY_TRANSIENT,
    /** Telemetry call failed because of auth or a malformed request. Retrying will not help. */
    TELEMETRY_FATAL,
    /** Retries ran out without a terminal match. Not an error for the caller. */
    CORRELATION_EXHAUSTED,
    /** The caller-supplied overall deadline elapsed. */
    DEADLINE_EXCEEDED
}
