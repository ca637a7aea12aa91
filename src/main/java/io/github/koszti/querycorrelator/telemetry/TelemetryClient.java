package io.github.koszti.querycorrelator.telemetry;

import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.QueryRequest;

import java.time.Duration;
import java.util.Optional;

/**
 * Out-of-band telemetry API of the query engine.
 * <p>
 * Failures are reported as {@link io.github.koszti.querycorrelator.exception.TelemetryTransientException}
 * (worth retrying) or {@link io.github.koszti.querycorrelator.exception.TelemetryFatalException}.
 * A record that does not exist (yet) is not a failure.
 */
public interface TelemetryClient
{
    /**
     * Executes the SQL again through the telemetry API's own execution path and blocks up to
     * {@code timeout} for a terminal state. This is a separate execution, unrelated to any primary
     * identifier. If the timeout elapses first, the last observed non-terminal record is returned.
     */
    ExecutionRecord submitAndWait(QueryRequest request, Duration timeout);

    /**
     * Fetches the server-recorded history entry of a previously issued query.
     *
     * @return empty when the server does not know the identifier (yet); otherwise a record that may
     *         still be in progress
     */
    Optional<ExecutionRecord> lookupByIdentifier(String identifier);

    /**
     * Fetches status and result manifest of a statement submitted through the statement API.
     *
     * @return empty when the statement is unknown
     */
    Optional<ExecutionRecord> getStatement(String statementId);
}
