package io.github.koszti.querycorrelator.config;

import io.github.koszti.querycorrelator.compare.DurationBasis;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "correlator.correlation")
public class CorrelatorCorrelationProperties {

    /**
     * Maximum number of lookup-by-identifier calls per query.
     */
    private int maxAttempts = 3;

    /**
     * Delay before each attempt, first entry applies to attempt 1. Must be strictly increasing.
     * Telemetry usually shows up within a few seconds of completion.
     */
    private List<Duration> delays = new ArrayList<>(List.of(
            Duration.ZERO, Duration.ofSeconds(2), Duration.ofSeconds(5)));

    /**
     * Overall budget of one correlation run, primary execution included.
     */
    private Duration deadline = Duration.ofMinutes(2);

    /**
     * Look up the telemetry record of a failed primary execution when an identifier was captured.
     */
    private boolean lookupAfterFailure = true;

    /**
     * Primary duration used for the delta against telemetry.
     */
    private DurationBasis durationBasis = DurationBasis.RESULT_HANDLE;

    /**
     * Threads available for running the primary and telemetry executions side by side.
     */
    private int parallelism = 4;

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public List<Duration> getDelays() {
        return delays;
    }

    public void setDelays(List<Duration> delays) {
        this.delays = delays;
    }

    public Duration getDeadline() {
        return deadline;
    }

    public void setDeadline(Duration deadline) {
        this.deadline = deadline;
    }

    public boolean isLookupAfterFailure() {
        return lookupAfterFailure;
    }

    public void setLookupAfterFailure(boolean lookupAfterFailure) {
        this.lookupAfterFailure = lookupAfterFailure;
    }

    public DurationBasis getDurationBasis() {
        return durationBasis;
    }

    public void setDurationBasis(DurationBasis durationBasis) {
        this.durationBasis = durationBasis;
    }

    public int getParallelism() {
        return Math.max(1, parallelism);
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }
}
