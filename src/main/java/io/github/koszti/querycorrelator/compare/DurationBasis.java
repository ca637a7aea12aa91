package io.github.koszti.querycorrelator.compare;

/**
 * Which primary-side duration is compared against the telemetry duration.
 */
public enum DurationBasis {
    /** Submission until the driver handed back a result handle. */
    RESULT_HANDLE,
    /** Submission until the last row was drained. */
    FULL_DRAIN
}
