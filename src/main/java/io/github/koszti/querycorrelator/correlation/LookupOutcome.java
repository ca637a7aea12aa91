package io.github.koszti.querycorrelator.correlation;

public enum LookupOutcome {
    NOT_FOUND,
    FOUND,
    TRANSIENT_ERROR,
    FATAL_ERROR
}
