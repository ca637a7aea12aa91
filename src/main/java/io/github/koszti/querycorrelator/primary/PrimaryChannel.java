package io.github.koszti.querycorrelator.primary;

import io.github.koszti.querycorrelator.model.QueryRequest;

import java.sql.SQLException;

/**
 * Client-driver path used to run queries.
 */
public interface PrimaryChannel {

    /**
     * Submits the query and returns once a result handle is available.
     * <p>
     * Implementations deliver the server identifier to {@code hook} before returning or throwing,
     * never afterwards.
     */
    PrimaryResultHandle submit(QueryRequest request, IdentifierCaptureHook hook) throws SQLException;
}
