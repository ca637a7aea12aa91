package io.github.koszti.querycorrelator.model;

import java.util.Objects;

/**
 * Immutable query submitted to both channels.
 */
public record QueryRequest(String sql, ExecutionTarget target) {

    public QueryRequest {
        Objects.requireNonNull(sql, "sql must not be null");
        if (sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be blank");
        }
        target = target == null ? ExecutionTarget.defaults() : target;
    }

    public static QueryRequest of(String sql) {
        return new QueryRequest(sql, null);
    }
}
