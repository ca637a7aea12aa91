package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.MutableClock;
import io.github.koszti.querycorrelator.compare.ComparisonMode;
import io.github.koszti.querycorrelator.compare.ComparisonResult;
import io.github.koszti.querycorrelator.compare.DurationBasis;
import io.github.koszti.querycorrelator.compare.ExecutionComparator;
import io.github.koszti.querycorrelator.config.CorrelatorCorrelationProperties;
import io.github.koszti.querycorrelator.exception.CorrelationErrorKind;
import io.github.koszti.querycorrelator.exception.TelemetryFatalException;
import io.github.koszti.querycorrelator.exception.TelemetryTransientException;
import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import io.github.koszti.querycorrelator.model.QueryRequest;
import io.github.koszti.querycorrelator.primary.FakePrimaryChannel;
import io.github.koszti.querycorrelator.primary.PrimaryChannel;
import io.github.koszti.querycorrelator.primary.PrimaryExecutionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrelationServiceTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CorrelationService service(FakePrimaryChannel channel, ScriptedTelemetryClient telemetry, Clock clock) {
        CorrelatorCorrelationProperties props = new CorrelatorCorrelationProperties();
        return new CorrelationService(new PrimaryExecutionClient(channel, clock), telemetry,
                new ExecutionComparator(DurationBasis.RESULT_HANDLE), props, clock, d -> { }, executor);
    }

    private static ExecutionRecord telemetryRecord(String id, ExecutionStatus status, long durationMillis) {
        return ExecutionRecord.builder(ExecutionOrigin.TELEMETRY)
                .identifier(id)
                .status(status)
                .observedStartMillis(0L)
                .observedEndMillis(status.isTerminal() ? durationMillis : null)
                .rowCount(1L)
                .columnCount(2)
                .build();
    }

    @Test
    void correlateRunsLookupForCapturedIdentifier() {
        MutableClock clock = new MutableClock(0L);
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.lookups(
                () -> Optional.of(telemetryRecord("01ef-svc", ExecutionStatus.SUCCEEDED, 115)));
        CorrelationService service = service(
                FakePrimaryChannel.succeeding("01ef-svc", 1, 2).withLatency(clock, 553, 0), telemetry, clock);

        ComparisonResult result = service.correlate(QueryRequest.of("SELECT 1"));

        assertEquals(ComparisonMode.LOOKUP, result.mode());
        assertEquals(CorrelationStatus.CORRELATED, result.status());
        assertEquals(Optional.of(438L), result.durationDelta());
    }

    @Test
    void eachCallGetsItsOwnEngine() {
        MutableClock clock = new MutableClock(0L);
        CorrelationService service = service(FakePrimaryChannel.succeeding("x", 0, 1), ScriptedTelemetryClient.lookups(), clock);

        assertNotEquals(service.newEngine(Duration.ofSeconds(1)), service.newEngine(Duration.ofSeconds(1)));
    }

    @Test
    void compareIndependentlyRunsBothExecutions() {
        CountDownLatch submitted = new CountDownLatch(1);
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(request -> {
            submitted.countDown();
            return telemetryRecord("s-independent", ExecutionStatus.SUCCEEDED, 115);
        });
        CorrelationService service = service(FakePrimaryChannel.succeeding("01ef-primary", 1, 2), telemetry,
                Clock.systemUTC());

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELECT 1"), Duration.ofSeconds(30));

        assertEquals(0, submitted.getCount());
        assertEquals(ComparisonMode.INDEPENDENT_EXECUTION, result.mode());
        assertEquals(CorrelationStatus.CORRELATED, result.status());
        assertEquals("01ef-primary", result.primary().getIdentifier());
        assertEquals("s-independent", result.telemetry().getIdentifier());
        assertTrue(result.rowCountAgreement());
        assertTrue(result.columnCountAgreement());
        assertTrue(telemetry.lookedUp().isEmpty());
    }

    @Test
    void compareIndependentlyReportsUnfinishedTelemetryAsDeadline() {
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(
                request -> telemetryRecord("s-slow", ExecutionStatus.RUNNING, 0));
        CorrelationService service = service(FakePrimaryChannel.succeeding("p", 1, 2), telemetry, Clock.systemUTC());

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELECT 1"), Duration.ofSeconds(30));

        assertEquals(CorrelationStatus.DEADLINE_EXCEEDED, result.status());
        assertEquals(ExecutionStatus.RUNNING, result.telemetry().getStatus());
        assertTrue(result.durationDelta().isEmpty());
    }

    @Test
    void compareIndependentlyReportsFatalTelemetry() {
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(request -> {
            throw new TelemetryFatalException(403, "PERMISSION_DENIED", "warehouse not accessible", null);
        });
        CorrelationService service = service(FakePrimaryChannel.succeeding("p", 1, 2), telemetry, Clock.systemUTC());

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELECT 1"), Duration.ofSeconds(30));

        assertEquals(CorrelationStatus.TELEMETRY_FATAL, result.status());
        assertNull(result.telemetry());
        assertEquals(ExecutionStatus.SUCCEEDED, result.primary().getStatus());
    }

    @Test
    void compareIndependentlyReportsUnavailableTelemetry() {
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(request -> {
            throw new TelemetryTransientException("https://example", 503, "busy");
        });
        CorrelationService service = service(FakePrimaryChannel.succeeding("p", 1, 2), telemetry, Clock.systemUTC());

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELECT 1"), Duration.ofSeconds(30));

        assertEquals(CorrelationStatus.TELEMETRY_UNAVAILABLE, result.status());
    }

    @Test
    void compareIndependentlyKeepsFailedPrimary() {
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(
                request -> telemetryRecord("s-1", ExecutionStatus.FAILED, 20));
        CorrelationService service = service(FakePrimaryChannel.failingOnSubmit("p-1", "syntax error"), telemetry,
                Clock.systemUTC());

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELEC 1"), Duration.ofSeconds(30));

        assertEquals(CorrelationStatus.EXECUTION_FAILED, result.status());
        assertEquals(CorrelationErrorKind.EXECUTION_FAILED, result.status().errorKind());
        assertEquals(ExecutionStatus.FAILED, result.primary().getStatus());
        assertEquals(ExecutionStatus.FAILED, result.telemetry().getStatus());
        assertEquals(1, result.correlationAttempts());
    }

    @Test
    void deadlineInterruptsRunningPrimary() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        PrimaryChannel blocking = (request, hook) -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new SQLException("cancelled", e);
            }
            throw new SQLException("not interrupted");
        };
        ScriptedTelemetryClient telemetry = ScriptedTelemetryClient.submitting(
                request -> telemetryRecord("s-1", ExecutionStatus.SUCCEEDED, 20));
        CorrelationService service = new CorrelationService(new PrimaryExecutionClient(blocking, Clock.systemUTC()),
                telemetry, new ExecutionComparator(DurationBasis.RESULT_HANDLE), new CorrelatorCorrelationProperties(),
                Clock.systemUTC(), d -> { }, executor);

        ComparisonResult result = service.compareIndependently(QueryRequest.of("SELECT 1"), Duration.ofMillis(300));

        assertEquals(CorrelationStatus.DEADLINE_EXCEEDED, result.status());
        assertEquals(ExecutionStatus.UNKNOWN, result.primary().getStatus());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }
}
