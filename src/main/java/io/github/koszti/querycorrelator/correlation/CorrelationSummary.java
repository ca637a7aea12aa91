package io.github.koszti.querycorrelator.correlation;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the telemetry side of a run: how it ended and the attempts it took.
 */
public record CorrelationSummary(CorrelationStatus status, List<CorrelationAttempt> attempts, String failureMessage) {

    public CorrelationSummary {
        Objects.requireNonNull(status, "status must not be null");
        attempts = List.copyOf(attempts);
    }

    public static CorrelationSummary of(CorrelationStatus status, List<CorrelationAttempt> attempts) {
        return new CorrelationSummary(status, attempts, null);
    }

    public static CorrelationSummary noIdentifier() {
        return new CorrelationSummary(CorrelationStatus.NO_IDENTIFIER, List.of(), null);
    }

    public boolean succeeded() {
        return status == CorrelationStatus.CORRELATED;
    }

    public int attemptCount() {
        return attempts.size();
    }
}
