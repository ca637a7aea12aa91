package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.compare.ComparisonMode;
import io.github.koszti.querycorrelator.compare.ComparisonResult;
import io.github.koszti.querycorrelator.compare.ExecutionComparator;
import io.github.koszti.querycorrelator.config.CorrelatorCorrelationProperties;
import io.github.koszti.querycorrelator.exception.ExecutionFailedException;
import io.github.koszti.querycorrelator.exception.TelemetryFatalException;
import io.github.koszti.querycorrelator.exception.TelemetryTransientException;
import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import io.github.koszti.querycorrelator.model.QueryRequest;
import io.github.koszti.querycorrelator.primary.PrimaryExecutionClient;
import io.github.koszti.querycorrelator.telemetry.TelemetryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for correlating queries. Every call gets its own {@link CorrelationEngine}, so
 * concurrent calls share no state.
 */
@Service
public class CorrelationService
{
    private static final Logger log = LoggerFactory.getLogger(CorrelationService.class);

    private final PrimaryExecutionClient primaryClient;
    private final TelemetryClient telemetryClient;
    private final ExecutionComparator comparator;
    private final CorrelatorCorrelationProperties correlationProps;
    private final RetrySchedule schedule;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService correlationExecutor;

    public CorrelationService(PrimaryExecutionClient primaryClient,
            TelemetryClient telemetryClient,
            ExecutionComparator comparator,
            CorrelatorCorrelationProperties correlationProps,
            Clock clock,
            Sleeper sleeper,
            ExecutorService correlationExecutor) {
        this.primaryClient = primaryClient;
        this.telemetryClient = telemetryClient;
        this.comparator = comparator;
        this.correlationProps = correlationProps;
        this.schedule = RetrySchedule.from(correlationProps);
        this.clock = clock;
        this.sleeper = sleeper;
        this.correlationExecutor = correlationExecutor;
    }

    public ComparisonResult correlate(QueryRequest request) {
        return correlate(request, correlationProps.getDeadline());
    }

    /**
     * Runs the query through the primary channel and looks up its telemetry record.
     *
     * @param deadline overall budget, primary execution included
     */
    public ComparisonResult correlate(QueryRequest request, Duration deadline) {
        return newEngine(deadline).run(request);
    }

    public ComparisonResult compareIndependently(QueryRequest request) {
        return compareIndependently(request, correlationProps.getDeadline());
    }

    /**
     * Runs the query through the primary channel and, concurrently, a second time through the
     * telemetry API's own execution path. The two executions have unrelated identifiers.
     */
    public ComparisonResult compareIndependently(QueryRequest request, Duration deadline) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");

        long deadlineAt = clock.millis() + deadline.toMillis();

        Future<ExecutionRecord> primaryFuture = correlationExecutor.submit(() -> executePrimary(request));
        Future<IndependentRun> telemetryFuture = correlationExecutor.submit(() -> executeTelemetry(request, deadline));

        ExecutionRecord primary;
        IndependentRun telemetry;
        try {
            primary = primaryFuture.get(remaining(deadlineAt), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            primaryFuture.cancel(true);
            telemetryFuture.cancel(true);
            primary = ExecutionRecord.builder(ExecutionOrigin.PRIMARY)
                    .status(ExecutionStatus.UNKNOWN)
                    .errorDetail("Deadline exceeded before the primary execution returned")
                    .build();
            return comparator.compare(ComparisonMode.INDEPENDENT_EXECUTION, primary, null,
                    new CorrelationSummary(CorrelationStatus.DEADLINE_EXCEEDED, List.of(), primary.getErrorDetail()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            primaryFuture.cancel(true);
            telemetryFuture.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for the primary execution", e);
        } catch (ExecutionException e) {
            telemetryFuture.cancel(true);
            throw new IllegalStateException("Primary execution failed unexpectedly", e.getCause());
        }

        try {
            telemetry = telemetryFuture.get(remaining(deadlineAt), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            telemetryFuture.cancel(true);
            telemetry = new IndependentRun(null, new CorrelationSummary(CorrelationStatus.DEADLINE_EXCEEDED,
                    List.of(), "Deadline exceeded before the telemetry execution returned"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            telemetryFuture.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for the telemetry execution", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Telemetry execution failed unexpectedly", e.getCause());
        }

        CorrelationSummary summary = telemetry.summary();
        if (primary.getStatus() == ExecutionStatus.FAILED) {
            summary = new CorrelationSummary(CorrelationStatus.EXECUTION_FAILED, summary.attempts(),
                    "Primary execution failed: " + primary.getErrorDetail());
        }
        return comparator.compare(ComparisonMode.INDEPENDENT_EXECUTION, primary, telemetry.record(), summary);
    }

    CorrelationEngine newEngine(Duration deadline) {
        return new CorrelationEngine(primaryClient, telemetryClient, comparator, schedule, clock, sleeper,
                deadline, correlationProps.isLookupAfterFailure());
    }

    private ExecutionRecord executePrimary(QueryRequest request) {
        try {
            return primaryClient.execute(request);
        } catch (ExecutionFailedException e) {
            return e.getRecord();
        }
    }

    private IndependentRun executeTelemetry(QueryRequest request, Duration timeout) {
        long issuedAt = clock.millis();
        try {
            ExecutionRecord record = telemetryClient.submitAndWait(request, timeout);
            CorrelationAttempt attempt = new CorrelationAttempt(1, issuedAt, LookupOutcome.FOUND, record.getStatus().name());
            CorrelationStatus status = record.getStatus().isTerminal()
                    ? CorrelationStatus.CORRELATED
                    : CorrelationStatus.DEADLINE_EXCEEDED;
            return new IndependentRun(record, CorrelationSummary.of(status, List.of(attempt)));
        } catch (TelemetryFatalException e) {
            log.error("Telemetry execution rejected: {}", e.getMessage());
            return new IndependentRun(null, new CorrelationSummary(CorrelationStatus.forError(e.getKind()),
                    List.of(new CorrelationAttempt(1, issuedAt, LookupOutcome.FATAL_ERROR, e.getMessage())),
                    e.getMessage()));
        } catch (TelemetryTransientException e) {
            log.warn("Telemetry execution failed: {}", e.getMessage());
            return new IndependentRun(null, new CorrelationSummary(CorrelationStatus.forError(e.getKind()),
                    List.of(new CorrelationAttempt(1, issuedAt, LookupOutcome.TRANSIENT_ERROR, e.getMessage())),
                    e.getMessage()));
        }
    }

    private long remaining(long deadlineAt) {
        return Math.max(0L, deadlineAt - clock.millis());
    }

    private record IndependentRun(ExecutionRecord record, CorrelationSummary summary) {}
}
