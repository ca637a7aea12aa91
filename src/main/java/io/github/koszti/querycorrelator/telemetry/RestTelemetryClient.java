package io.github.koszti.querycorrelator.telemetry;

import io.github.koszti.querycorrelator.config.CorrelatorTelemetryProperties;
import io.github.koszti.querycorrelator.exception.TelemetryFatalException;
import io.github.koszti.querycorrelator.exception.TelemetryTransientException;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionTarget;
import io.github.koszti.querycorrelator.model.QueryRequest;
import io.github.koszti.querycorrelator.telemetry.dto.QueryHistoryResponse;
import io.github.koszti.querycorrelator.telemetry.dto.StatementExecutionRequest;
import io.github.koszti.querycorrelator.telemetry.dto.StatementResponse;
import io.github.koszti.querycorrelator.telemetry.dto.TelemetryErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Service
public class RestTelemetryClient implements TelemetryClient
{
    private static final Logger log = LoggerFactory.getLogger(RestTelemetryClient.class);

    static final String STATEMENTS_PATH = "/api/2.0/sql/statements/";
    static final String STATEMENT_PATH = "/api/2.0/sql/statements/{id}";
    static final String HISTORY_PATH = "/api/2.0/sql/history/queries/{id}";

    // API bounds for wait_timeout; 0 means return immediately
    static final long MIN_WAIT_SECONDS = 5;
    static final long MAX_WAIT_SECONDS = 50;

    private static final Set<String> NOT_FOUND_ERROR_CODES = Set.of("RESOURCE_DOES_NOT_EXIST", "NOT_FOUND");

    private final RestClient restClient;
    private final CorrelatorTelemetryProperties telemetryProps;
    private final TelemetryRecordNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RestTelemetryClient(RestClient telemetryRestClient,
            CorrelatorTelemetryProperties telemetryProps,
            TelemetryRecordNormalizer normalizer,
            ObjectMapper objectMapper,
            Clock clock) {
        this.restClient = telemetryRestClient;
        this.telemetryProps = telemetryProps;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ExecutionRecord submitAndWait(QueryRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        StatementExecutionRequest body = toExecutionRequest(request, timeout);
        log.debug("Submitting statement to telemetry API: warehouse={}, wait={}, sql={}",
                body.getWarehouseId(), body.getWaitTimeout(), request.sql());

        long sentAt = clock.millis();
        long deadline = sentAt + timeout.toMillis();

        StatementResponse response = call("submit statement", false, () -> restClient
                .post()
                .uri(STATEMENTS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(StatementResponse.class))
                .orElse(null);

        if (response == null || response.getStatementId() == null) {
            throw new TelemetryFatalException(200, null, "Statement API returned no statement_id", null);
        }

        String statementId = response.getStatementId();
        ExecutionRecord record = normalizer.fromStatement(response, sentAt, clock.millis());

        // Follow the statement until it is terminal or the caller's timeout is used up
        long pollMillis = Math.max(1L, telemetryProps.getPollInterval().toMillis());
        while (!record.getStatus().isTerminal()) {
            if (clock.millis() + pollMillis > deadline) {
                log.warn("Statement {} still {} after {}; returning last observed state",
                        statementId, record.getStatus(), timeout);
                return record;
            }

            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TelemetryTransientException(telemetryProps.getBaseUrl(), ie);
            }

            StatementResponse polled = fetchStatement(statementId)
                    .orElseThrow(() -> new TelemetryTransientException(telemetryProps.getBaseUrl(), 404,
                            "Statement " + statementId + " disappeared while polling"));
            record = normalizer.fromStatement(polled, sentAt, clock.millis());
        }

        log.info("Telemetry statement finished. id={}, status={}, durationMs={}, rows={}, columns={}",
                statementId, record.getStatus(), record.getDurationMillis(),
                record.getRowCount(), record.getColumnCount());
        return record;
    }

    @Override
    public Optional<ExecutionRecord> lookupByIdentifier(String identifier) {
        requireIdentifier(identifier);

        Optional<QueryHistoryResponse> response = call("lookup query " + identifier, true, () -> restClient
                .get()
                .uri(HISTORY_PATH, identifier)
                .retrieve()
                .body(QueryHistoryResponse.class));

        if (response.isEmpty()) {
            log.debug("Query {} not (yet) known to query history", identifier);
            return Optional.empty();
        }

        QueryHistoryResponse history = response.get();
        if (history.getQueryId() == null) {
            history.setQueryId(identifier);
        }
        ExecutionRecord record = normalizer.fromHistory(history);
        if (record.getStatus().isTerminal() && record.getColumnCount() == null) {
            record = withResultShape(record);
        }
        return Optional.of(record);
    }

    @Override
    public Optional<ExecutionRecord> getStatement(String statementId) {
        requireIdentifier(statementId);

        return fetchStatement(statementId).map(r -> normalizer.fromStatement(r, null, null));
    }

    private Optional<StatementResponse> fetchStatement(String statementId) {
        return call("get statement " + statementId, true, () -> restClient
                .get()
                .uri(STATEMENT_PATH, statementId)
                .retrieve()
                .body(StatementResponse.class));
    }

    /**
     * Query history carries no result schema; the statement API's manifest does. A statement
     * the API no longer knows, or cannot serve, leaves the history record as it is.
     */
    private ExecutionRecord withResultShape(ExecutionRecord history) {
        String id = history.getIdentifier();
        Optional<ExecutionRecord> statement;
        try {
            statement = getStatement(id);
        } catch (TelemetryTransientException | TelemetryFatalException e) {
            log.warn("Result manifest of {} unavailable, column count unknown: {}", id, e.getMessage());
            return history;
        }
        if (statement.isEmpty()) {
            log.debug("Statement API does not know {}; column count unknown", id);
            return history;
        }

        ExecutionRecord manifest = statement.get();
        return history.toBuilder()
                .columnCount(manifest.getColumnCount())
                .chunkCount(manifest.getChunkCount())
                .rowCount(history.getRowCount() != null ? history.getRowCount() : manifest.getRowCount())
                .build();
    }

    private StatementExecutionRequest toExecutionRequest(QueryRequest request, Duration timeout) {
        ExecutionTarget target = request.target();

        String warehouseId = target.warehouseId() != null ? target.warehouseId() : telemetryProps.getWarehouseId();
        if (warehouseId == null || warehouseId.isBlank()) {
            throw new IllegalStateException("No warehouse id given in the request or in correlator.telemetry.warehouse-id");
        }

        Duration wait = target.waitTimeout() != null ? target.waitTimeout() : telemetryProps.getWaitTimeout();

        StatementExecutionRequest body = new StatementExecutionRequest();
        body.setStatement(request.sql());
        body.setWarehouseId(warehouseId);
        body.setWaitTimeout(waitTimeoutParameter(wait, timeout));
        body.setOnWaitTimeout("CONTINUE");
        body.setFormat(target.format() != null ? target.format() : telemetryProps.getFormat());
        body.setDisposition(target.disposition() != null ? target.disposition() : telemetryProps.getDisposition());
        return body;
    }

    /**
     * Server-side wait, never longer than the caller's timeout. Waits below the API minimum become
     * an asynchronous submission followed by polling.
     */
    static String waitTimeoutParameter(Duration wait, Duration callerTimeout) {
        long seconds = Math.min(wait.getSeconds(), callerTimeout.getSeconds());
        if (seconds < MIN_WAIT_SECONDS) {
            return "0s";
        }
        return Math.min(seconds, MAX_WAIT_SECONDS) + "s";
    }

    private <T> Optional<T> call(String operation, boolean notFoundIsEmpty, Supplier<T> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (RestClientResponseException e) {
            TelemetryErrorResponse error = parseError(e);
            if (notFoundIsEmpty && isNotFound(e.getStatusCode().value(), error)) {
                return Optional.empty();
            }
            throw translate(operation, e, error);
        } catch (ResourceAccessException e) {
            throw new TelemetryTransientException(telemetryProps.getBaseUrl(), e);
        } catch (RestClientException e) {
            throw new TelemetryFatalException(-1, null,
                    "Telemetry API " + operation + " returned an unreadable response: " + e.getMessage(), e);
        }
    }

    private RuntimeException translate(String operation, RestClientResponseException e, TelemetryErrorResponse error) {
        int status = e.getStatusCode().value();
        String detail = error != null && error.getMessage() != null ? error.getMessage() : e.getResponseBodyAsString();
        String message = "Telemetry API " + operation + " failed with HTTP " + status + ": " + detail;

        if (status >= 500 || status == 429 || status == 408) {
            return new TelemetryTransientException(telemetryProps.getBaseUrl(), status, message);
        }
        return new TelemetryFatalException(status, error != null ? error.getErrorCode() : null, message, e);
    }

    private static boolean isNotFound(int status, TelemetryErrorResponse error) {
        if (status == 404) {
            return true;
        }
        return status == 400 && error != null && error.getErrorCode() != null
                && NOT_FOUND_ERROR_CODES.contains(error.getErrorCode());
    }

    private TelemetryErrorResponse parseError(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, TelemetryErrorResponse.class);
        } catch (JsonProcessingException pe) {
            log.debug("Error body is not JSON: {}", body);
            return null;
        }
    }

    private static void requireIdentifier(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }
}
