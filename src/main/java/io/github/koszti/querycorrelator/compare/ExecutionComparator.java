package io.github.koszti.querycorrelator.compare;

import io.github.koszti.querycorrelator.correlation.CorrelationSummary;
import io.github.koszti.querycorrelator.model.ExecutionRecord;

import java.util.Objects;

/**
 * Derives comparison metrics from two already collected records. No I/O, no state: the same
 * inputs always give an equal {@link ComparisonResult}.
 * <p>
 * Mismatching counts are reported as they are. A count missing on either side is a mismatch,
 * and a missing duration makes the delta unavailable rather than zero.
 */
public final class ExecutionComparator
{
    private final DurationBasis durationBasis;

    public ExecutionComparator(DurationBasis durationBasis) {
        this.durationBasis = Objects.requireNonNull(durationBasis, "durationBasis must not be null");
    }

    public DurationBasis getDurationBasis() {
        return durationBasis;
    }

    public ComparisonResult compare(ExecutionRecord primary, ExecutionRecord telemetry, CorrelationSummary correlation) {
        return compare(ComparisonMode.LOOKUP, primary, telemetry, correlation);
    }

    /**
     * @param telemetry may be null when no telemetry record was obtained
     */
    public ComparisonResult compare(ComparisonMode mode,
            ExecutionRecord primary,
            ExecutionRecord telemetry,
            CorrelationSummary correlation) {
        Objects.requireNonNull(primary, "primary must not be null");
        Objects.requireNonNull(correlation, "correlation must not be null");

        Long delta = null;
        Long primaryDuration = durationBasis == DurationBasis.FULL_DRAIN
                ? primary.getDrainDurationMillis()
                : primary.getDurationMillis();
        Long telemetryDuration = telemetry != null ? telemetry.getDurationMillis() : null;
        if (primaryDuration != null && telemetryDuration != null) {
            delta = Math.abs(primaryDuration - telemetryDuration);
        }

        boolean rowsAgree = telemetry != null && bothPresentAndEqual(primary.getRowCount(), telemetry.getRowCount());
        boolean columnsAgree = telemetry != null
                && bothPresentAndEqual(primary.getColumnCount(), telemetry.getColumnCount());

        return new ComparisonResult(mode, primary, telemetry, delta, durationBasis, rowsAgree, columnsAgree, correlation);
    }

    private static boolean bothPresentAndEqual(Object a, Object b) {
        return a != null && a.equals(b);
    }
}
