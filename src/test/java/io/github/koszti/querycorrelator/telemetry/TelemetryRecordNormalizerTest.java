package io.github.koszti.querycorrelator.telemetry;

import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import io.github.koszti.querycorrelator.model.TimingEndpoints;
import io.github.koszti.querycorrelator.telemetry.dto.QueryHistoryResponse;
import io.github.koszti.querycorrelator.telemetry.dto.StatementResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TelemetryRecordNormalizerTest {

    private final TelemetryRecordNormalizer normalizer = new TelemetryRecordNormalizer();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static QueryHistoryResponse history(String status, Long start, Long execEnd, Long queryEnd) {
        QueryHistoryResponse h = new QueryHistoryResponse();
        h.setQueryId("01ef-hist");
        h.setStatus(status);
        h.setQueryStartTimeMs(start);
        h.setExecutionEndTimeMs(execEnd);
        h.setQueryEndTimeMs(queryEnd);
        return h;
    }

    @Test
    void historyDurationSpansQueryStartToQueryEnd() {
        QueryHistoryResponse h = history("FINISHED", 10_000L, 10_100L, 10_115L);
        h.setDuration(120L);
        h.setRowsProduced(1L);

        ExecutionRecord record = normalizer.fromHistory(h);

        assertEquals(ExecutionOrigin.TELEMETRY, record.getOrigin());
        assertEquals(ExecutionStatus.SUCCEEDED, record.getStatus());
        assertEquals(115L, record.getDurationMillis());
        assertEquals(120L, record.getReportedDurationMillis());
        assertEquals(new TimingEndpoints("query_start_time_ms", "query_end_time_ms"), record.getTimingEndpoints());
        assertEquals(1L, record.getRowCount());
        assertNull(record.getColumnCount());
    }

    @Test
    void historyFallsBackToExecutionEnd() {
        ExecutionRecord record = normalizer.fromHistory(history("FINISHED", 10_000L, 10_100L, null));

        assertEquals(100L, record.getDurationMillis());
        assertEquals("execution_end_time_ms", record.getTimingEndpoints().end());
    }

    @Test
    void runningHistoryHasNoDuration() {
        ExecutionRecord record = normalizer.fromHistory(history("RUNNING", 10_000L, null, null));

        assertEquals(ExecutionStatus.RUNNING, record.getStatus());
        assertNull(record.getDurationMillis());
        assertEquals(TimingEndpoints.NONE, record.getTimingEndpoints());
    }

    @Test
    void failedHistoryKeepsErrorMessage() {
        QueryHistoryResponse h = history("FAILED", 1L, 2L, 3L);
        h.setErrorMessage("[DIVIDE_BY_ZERO] Division by zero");

        ExecutionRecord record = normalizer.fromHistory(h);

        assertEquals(ExecutionStatus.FAILED, record.getStatus());
        assertEquals("[DIVIDE_BY_ZERO] Division by zero", record.getErrorDetail());
    }

    @Test
    void terminalStatementUsesClientRoundTrip() throws Exception {
        StatementResponse resp = objectMapper.readValue("""
                {"statement_id":"s-1","status":{"state":"SUCCEEDED"},
                 "manifest":{"schema":{"column_count":2},"total_chunk_count":1,"total_row_count":1}}
                """, StatementResponse.class);

        ExecutionRecord record = normalizer.fromStatement(resp, 5_000L, 5_115L);

        assertEquals("s-1", record.getIdentifier());
        assertEquals(115L, record.getDurationMillis());
        assertEquals(TimingEndpoints.CLIENT_ROUND_TRIP, record.getTimingEndpoints());
        assertEquals(1L, record.getRowCount());
        assertEquals(2, record.getColumnCount());
        assertEquals(1, record.getChunkCount());
    }

    @Test
    void pendingStatementHasNoEnd() throws Exception {
        StatementResponse resp = objectMapper.readValue(
                "{\"statement_id\":\"s-2\",\"status\":{\"state\":\"PENDING\"}}", StatementResponse.class);

        ExecutionRecord record = normalizer.fromStatement(resp, 5_000L, 5_010L);

        assertEquals(ExecutionStatus.PENDING, record.getStatus());
        assertEquals(5_000L, record.getObservedStartMillis());
        assertNull(record.getObservedEndMillis());
        assertEquals(TimingEndpoints.NONE, record.getTimingEndpoints());
    }

    @Test
    void statementErrorCombinesCodeAndMessage() throws Exception {
        StatementResponse resp = objectMapper.readValue("""
                {"statement_id":"s-3","status":{"state":"FAILED",
                 "error":{"error_code":"BAD_REQUEST","message":"syntax error"}}}
                """, StatementResponse.class);

        ExecutionRecord record = normalizer.fromStatement(resp, null, null);

        assertEquals(ExecutionStatus.FAILED, record.getStatus());
        assertEquals("BAD_REQUEST: syntax error", record.getErrorDetail());
        assertNull(record.getDurationMillis());
    }
}
