package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.compare.ComparisonResult;
import io.github.koszti.querycorrelator.compare.ExecutionComparator;
import io.github.koszti.querycorrelator.exception.ExecutionFailedException;
import io.github.koszti.querycorrelator.exception.TelemetryFatalException;
import io.github.koszti.querycorrelator.exception.TelemetryTransientException;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.QueryRequest;
import io.github.koszti.querycorrelator.primary.PrimaryExecutionClient;
import io.github.koszti.querycorrelator.telemetry.TelemetryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Correlates one query: runs it through the primary channel, then looks up the telemetry record
 * for the identifier the primary channel assigned.
 * <p>
 * Telemetry lags the primary execution by a bounded but unknown amount, so the lookup is retried
 * on a {@link RetrySchedule}. The loop ends on the first terminal record, on a fatal telemetry
 * error, when attempts run out or when the deadline leaves no room for the next attempt. None of
 * these endings throws; the caller always gets a {@link ComparisonResult}. A failed primary
 * execution ends the run as {@link CorrelationStatus#EXECUTION_FAILED}.
 * <p>
 * An engine serves exactly one run and is not thread-safe.
 */
public class CorrelationEngine
{
    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private final PrimaryExecutionClient primaryClient;
    private final TelemetryClient telemetryClient;
    private final ExecutionComparator comparator;
    private final RetrySchedule schedule;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration budget;
    private final boolean lookupAfterFailure;
    private final AtomicBoolean used = new AtomicBoolean(false);

    public CorrelationEngine(PrimaryExecutionClient primaryClient,
            TelemetryClient telemetryClient,
            ExecutionComparator comparator,
            RetrySchedule schedule,
            Clock clock,
            Sleeper sleeper,
            Duration budget,
            boolean lookupAfterFailure) {
        this.primaryClient = primaryClient;
        this.telemetryClient = Objects.requireNonNull(telemetryClient, "telemetryClient must not be null");
        this.comparator = Objects.requireNonNull(comparator, "comparator must not be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.lookupAfterFailure = lookupAfterFailure;
    }

    /**
     * Executes the query through the primary channel and correlates it. The budget covers both.
     */
    public ComparisonResult run(QueryRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(primaryClient, "primaryClient is required to run a query");
        claim();

        long deadline = clock.millis() + budget.toMillis();

        ExecutionRecord primary;
        try {
            primary = primaryClient.execute(request);
        } catch (ExecutionFailedException e) {
            return failedExecution(e, deadline);
        }

        return compareWithLookup(primary, deadline);
    }

    /**
     * Correlates a primary execution that already happened. The budget starts now.
     */
    public ComparisonResult correlate(ExecutionRecord primary) {
        Objects.requireNonNull(primary, "primary must not be null");
        claim();
        return compareWithLookup(primary, clock.millis() + budget.toMillis());
    }

    /**
     * The run ends as {@link CorrelationStatus#EXECUTION_FAILED} whatever the lookup finds; a
     * captured identifier only buys a best-effort fetch of the server's failure record.
     */
    private ComparisonResult failedExecution(ExecutionFailedException e, long deadline) {
        ExecutionRecord primary = e.getRecord();
        CorrelationStatus status = CorrelationStatus.forError(e.getKind());
        if (!lookupAfterFailure || !primary.hasIdentifier()) {
            return comparator.compare(primary, null, new CorrelationSummary(status, List.of(), e.getMessage()));
        }

        log.info("Looking up telemetry of failed execution {}", primary.getIdentifier());
        LookupRun lookup = lookup(primary, deadline);
        return comparator.compare(primary, lookup.telemetry(),
                new CorrelationSummary(status, lookup.summary().attempts(), e.getMessage()));
    }

    private ComparisonResult compareWithLookup(ExecutionRecord primary, long deadline) {
        LookupRun lookup = lookup(primary, deadline);
        return comparator.compare(primary, lookup.telemetry(), lookup.summary());
    }

    private LookupRun lookup(ExecutionRecord primary, long deadline) {
        if (!primary.hasIdentifier()) {
            log.info("No primary identifier captured; skipping telemetry lookup");
            return new LookupRun(CorrelationSummary.noIdentifier(), null);
        }

        String id = primary.getIdentifier();
        List<CorrelationAttempt> attempts = new ArrayList<>();
        ExecutionRecord lastSeen = null;

        for (int n = 1; n <= schedule.getMaxAttempts(); n++) {
            Duration delay = schedule.delayBefore(n);
            long now = clock.millis();
            if (now + delay.toMillis() >= deadline) {
                log.warn("Deadline reached before lookup attempt {} for {} (delay {})", n, id, delay);
                return new LookupRun(new CorrelationSummary(CorrelationStatus.DEADLINE_EXCEEDED, attempts,
                        "Deadline exceeded before attempt " + n), null);
            }

            if (!delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Correlation of {} interrupted while waiting for attempt {}", id, n);
                    return new LookupRun(new CorrelationSummary(CorrelationStatus.CANCELLED, attempts,
                            "Interrupted before attempt " + n), null);
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                return new LookupRun(new CorrelationSummary(CorrelationStatus.CANCELLED, attempts,
                        "Interrupted before attempt " + n), null);
            }

            long issuedAt = clock.millis();
            try {
                Optional<ExecutionRecord> found = telemetryClient.lookupByIdentifier(id);
                if (found.isEmpty()) {
                    attempts.add(new CorrelationAttempt(n, issuedAt, LookupOutcome.NOT_FOUND, null));
                    log.debug("Attempt {}: {} not found yet", n, id);
                    continue;
                }

                ExecutionRecord record = found.get();
                attempts.add(new CorrelationAttempt(n, issuedAt, LookupOutcome.FOUND, record.getStatus().name()));
                if (record.getStatus().isTerminal()) {
                    log.info("Correlated {} on attempt {} (status {})", id, n, record.getStatus());
                    return new LookupRun(CorrelationSummary.of(CorrelationStatus.CORRELATED, attempts), record);
                }
                log.debug("Attempt {}: {} still {}", n, id, record.getStatus());
                lastSeen = record;
            } catch (TelemetryFatalException e) {
                attempts.add(new CorrelationAttempt(n, issuedAt, LookupOutcome.FATAL_ERROR, e.getMessage()));
                log.error("Telemetry lookup of {} rejected: {}", id, e.getMessage());
                return new LookupRun(new CorrelationSummary(CorrelationStatus.forError(e.getKind()), attempts,
                        e.getMessage()), null);
            } catch (TelemetryTransientException e) {
                attempts.add(new CorrelationAttempt(n, issuedAt, LookupOutcome.TRANSIENT_ERROR, e.getMessage()));
                log.warn("Attempt {}: transient telemetry failure for {}: {}", n, id, e.getMessage());
            }
        }

        log.warn("No terminal telemetry record for {} after {} attempt(s)", id, attempts.size());
        return new LookupRun(new CorrelationSummary(CorrelationStatus.CORRELATION_EXHAUSTED, attempts,
                "No terminal telemetry record after " + attempts.size() + " attempt(s)"), lastSeen);
    }

    private void claim() {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("CorrelationEngine instances serve a single run");
        }
    }

    private record LookupRun(CorrelationSummary summary, ExecutionRecord telemetry) {}
}
