package io.github.koszti.querycorrelator.model;

/**
 * Channel an {@link ExecutionRecord} was observed through.
 */
public enum ExecutionOrigin {
    PRIMARY,
    TELEMETRY
}
