package io.github.koszti.querycorrelator.model;

import java.time.Duration;

/**
 * Optional execution context for a {@link QueryRequest}. Any field may be null, in which
 * case the configured default applies.
 *
 * @param warehouseId compute resource the statement should run on
 * @param waitTimeout how long the telemetry API should block before answering a submission
 * @param format result format, e.g. {@code JSON_ARRAY}
 * @param disposition result materialization mode, e.g. {@code INLINE}
 */
public record ExecutionTarget(String warehouseId, Duration waitTimeout, String format, String disposition) {

    public static ExecutionTarget defaults() {
        return new ExecutionTarget(null, null, null, null);
    }
}
