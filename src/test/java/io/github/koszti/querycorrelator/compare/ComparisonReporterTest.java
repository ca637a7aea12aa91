package io.github.koszti.querycorrelator.compare;

import io.github.koszti.querycorrelator.correlation.CorrelationAttempt;
import io.github.koszti.querycorrelator.correlation.CorrelationStatus;
import io.github.koszti.querycorrelator.correlation.CorrelationSummary;
import io.github.koszti.querycorrelator.correlation.LookupOutcome;
import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonReporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ComparisonReporter reporter = new ComparisonReporter(objectMapper);

    private static ComparisonResult correlated() {
        ExecutionRecord primary = ExecutionRecord.builder(ExecutionOrigin.PRIMARY)
                .identifier("01ef-q").status(ExecutionStatus.SUCCEEDED)
                .observedStartMillis(0L).observedEndMillis(553L).rowCount(1L).columnCount(2).build();
        ExecutionRecord telemetry = ExecutionRecord.builder(ExecutionOrigin.TELEMETRY)
                .identifier("01ef-q").status(ExecutionStatus.SUCCEEDED)
                .observedStartMillis(100L).observedEndMillis(215L).rowCount(1L).build();
        CorrelationSummary summary = CorrelationSummary.of(CorrelationStatus.CORRELATED, List.of(
                new CorrelationAttempt(1, 600L, LookupOutcome.NOT_FOUND, null),
                new CorrelationAttempt(2, 2_600L, LookupOutcome.FOUND, "SUCCEEDED")));
        return new ExecutionComparator(DurationBasis.RESULT_HANDLE).compare(primary, telemetry, summary);
    }

    @Test
    void summaryNamesStatusDeltaAndMismatches() {
        String line = reporter.summarize(correlated());

        assertTrue(line.startsWith("LOOKUP CORRELATED after 2 attempt(s)"), line);
        assertTrue(line.contains("delta 438ms"), line);
        assertTrue(line.contains("rows agree"), line);
        assertTrue(line.contains("columns MISMATCH"), line);
    }

    @Test
    void summaryWithoutTelemetry() {
        ExecutionRecord primary = ExecutionRecord.builder(ExecutionOrigin.PRIMARY)
                .status(ExecutionStatus.FAILED).errorDetail("boom").build();
        ComparisonResult result = new ExecutionComparator(DurationBasis.RESULT_HANDLE).compare(primary, null,
                new CorrelationSummary(CorrelationStatus.EXECUTION_FAILED, List.of(), "Primary execution failed: boom"));

        String line = reporter.summarize(result);

        assertTrue(line.contains("telemetry (none)"), line);
        assertTrue(line.contains("delta unavailable"), line);
        assertTrue(line.endsWith("Primary execution failed: boom"), line);
    }

    @Test
    void rendersJson() throws Exception {
        JsonNode json = objectMapper.readTree(reporter.toJson(correlated()));

        assertEquals("LOOKUP", json.get("mode").asText());
        assertEquals(438L, json.get("durationDeltaMillis").asLong());
        assertEquals("01ef-q", json.get("primary").get("identifier").asText());
        assertEquals(553L, json.get("primary").get("durationMillis").asLong());
        assertEquals("CORRELATED", json.get("correlation").get("status").asText());
        assertEquals(2, json.get("correlation").get("attempts").size());
    }
}
