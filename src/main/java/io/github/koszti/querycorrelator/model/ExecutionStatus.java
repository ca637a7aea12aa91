package io.github.koszti.querycorrelator.model;

import java.util.Locale;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    UNKNOWN;

    /**
     * A terminal status will not change any further.
     * {@link #UNKNOWN} is not terminal: the server may still report a real state later.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Maps the state names used by the statement execution API and the query history API.
     */
    public static ExecutionStatus fromTelemetryState(String state) {
        if (state == null || state.isBlank()) {
            return UNKNOWN;
        }
        switch (state.trim().toUpperCase(Locale.ROOT)) {
            case "QUEUED":
            case "PENDING":
                return PENDING;
            case "RUNNING":
                return RUNNING;
            case "FINISHED":
            case "SUCCEEDED":
            case "CLOSED":
                return SUCCEEDED;
            case "FAILED":
                return FAILED;
            case "CANCELED":
            case "CANCELLED":
                return CANCELLED;
            default:
                return UNKNOWN;
        }
    }
}
