package io.github.koszti.querycorrelator.compare;

public enum ComparisonMode {
    /** Telemetry record fetched by the identifier the primary channel assigned. */
    LOOKUP,
    /** Telemetry record from a separate execution of the same SQL through the telemetry API. */
    INDEPENDENT_EXECUTION
}
