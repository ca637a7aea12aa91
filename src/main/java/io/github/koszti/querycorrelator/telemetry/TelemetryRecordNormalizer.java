package io.github.koszti.querycorrelator.telemetry;

import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import io.github.koszti.querycorrelator.model.TimingEndpoints;
import io.github.koszti.querycorrelator.telemetry.dto.QueryHistoryResponse;
import io.github.koszti.querycorrelator.telemetry.dto.StatementResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Turns the telemetry API's response shapes into {@link ExecutionRecord}s.
 * <p>
 * Durations are always computed from two timestamps and the record names them. The server's own
 * {@code duration} field is kept for reference and logged when it disagrees with the computed one,
 * since it may be measured to a different end point.
 */
@Component
public class TelemetryRecordNormalizer
{
    private static final Logger log = LoggerFactory.getLogger(TelemetryRecordNormalizer.class);

    static final String QUERY_START = "query_start_time_ms";
    static final String QUERY_END = "query_end_time_ms";
    static final String EXECUTION_END = "execution_end_time_ms";

    /**
     * Allowed gap between the computed and the server-reported duration before it is logged.
     */
    static final long REPORTED_DURATION_TOLERANCE_MS = 5;

    public ExecutionRecord fromHistory(QueryHistoryResponse response) {
        Objects.requireNonNull(response, "response must not be null");

        ExecutionStatus status = ExecutionStatus.fromTelemetryState(response.getStatus());
        Long start = response.getQueryStartTimeMs();
        Long end = response.getQueryEndTimeMs();
        String endName = QUERY_END;
        if (end == null && response.getExecutionEndTimeMs() != null) {
            end = response.getExecutionEndTimeMs();
            endName = EXECUTION_END;
        }

        TimingEndpoints endpoints = start != null && end != null
                ? new TimingEndpoints(QUERY_START, endName)
                : TimingEndpoints.NONE;

        ExecutionRecord record = ExecutionRecord.builder(ExecutionOrigin.TELEMETRY)
                .identifier(response.getQueryId())
                .status(status)
                .observedStartMillis(start)
                .observedEndMillis(end)
                .reportedDurationMillis(response.getDuration())
                .rowCount(response.getRowsProduced())
                .errorDetail(blankToNull(response.getErrorMessage()))
                .timingEndpoints(endpoints)
                .build();

        crossCheck(record);
        return record;
    }

    /**
     * @param requestSentMillis client clock when the submission was sent, null for a plain status read
     * @param responseMillis client clock when the (terminal) response arrived, null for a plain status read
     */
    public ExecutionRecord fromStatement(StatementResponse response, Long requestSentMillis, Long responseMillis) {
        Objects.requireNonNull(response, "response must not be null");

        StatementResponse.Status st = response.getStatus();
        ExecutionStatus status = ExecutionStatus.fromTelemetryState(st != null ? st.getState() : null);

        String errorDetail = null;
        if (st != null && st.getError() != null) {
            StatementResponse.StatementError error = st.getError();
            errorDetail = error.getErrorCode() != null
                    ? error.getErrorCode() + ": " + error.getMessage()
                    : error.getMessage();
        }

        ExecutionRecord.Builder builder = ExecutionRecord.builder(ExecutionOrigin.TELEMETRY)
                .identifier(response.getStatementId())
                .status(status)
                .errorDetail(blankToNull(errorDetail));

        StatementResponse.Manifest manifest = response.getManifest();
        if (manifest != null) {
            builder.rowCount(manifest.getTotalRowCount())
                    .chunkCount(manifest.getTotalChunkCount())
                    .columnCount(manifest.getSchema() != null ? manifest.getSchema().getColumnCount() : null);
        }

        // a client-observed end point only means something once the statement is done
        if (requestSentMillis != null && responseMillis != null && status.isTerminal()) {
            builder.observedStartMillis(requestSentMillis)
                    .observedEndMillis(responseMillis)
                    .timingEndpoints(TimingEndpoints.CLIENT_ROUND_TRIP);
        } else {
            builder.observedStartMillis(requestSentMillis)
                    .timingEndpoints(TimingEndpoints.NONE);
        }
        return builder.build();
    }

    private static void crossCheck(ExecutionRecord record) {
        Long computed = record.getDurationMillis();
        Long reported = record.getReportedDurationMillis();
        if (computed == null || reported == null) {
            return;
        }
        if (Math.abs(computed - reported) > REPORTED_DURATION_TOLERANCE_MS) {
            log.debug("Server-reported duration {}ms differs from {} = {}ms for {}",
                    reported, record.getTimingEndpoints(), computed, record.getIdentifier());
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
