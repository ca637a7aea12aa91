package io.github.koszti.querycorrelator.compare;

import io.github.koszti.querycorrelator.correlation.CorrelationStatus;
import io.github.koszti.querycorrelator.correlation.CorrelationSummary;
import io.github.koszti.querycorrelator.model.ExecutionRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Side-by-side view of one logical query as seen by the primary channel and by telemetry.
 *
 * @param telemetry null when no telemetry record could be obtained
 * @param durationDeltaMillis {@code |primary - telemetry|}, null when either duration is unavailable
 */
public record ComparisonResult(
        ComparisonMode mode,
        ExecutionRecord primary,
        ExecutionRecord telemetry,
        Long durationDeltaMillis,
        DurationBasis durationBasis,
        boolean rowCountAgreement,
        boolean columnCountAgreement,
        CorrelationSummary correlation
) {

    public ComparisonResult {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(primary, "primary must not be null");
        Objects.requireNonNull(durationBasis, "durationBasis must not be null");
        Objects.requireNonNull(correlation, "correlation must not be null");
    }

    public Optional<ExecutionRecord> telemetryRecord() {
        return Optional.ofNullable(telemetry);
    }

    public Optional<Long> durationDelta() {
        return Optional.ofNullable(durationDeltaMillis);
    }

    public int correlationAttempts() {
        return correlation.attemptCount();
    }

    public boolean correlationSucceeded() {
        return correlation.succeeded();
    }

    public CorrelationStatus status() {
        return correlation.status();
    }
}
