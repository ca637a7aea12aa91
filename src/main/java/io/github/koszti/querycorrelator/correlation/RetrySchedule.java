package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.config.CorrelatorCorrelationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Bounded lookup schedule: a maximum number of attempts and the delay before each one.
 * <p>
 * Delays are strictly increasing. When more attempts are allowed than delays are configured, the
 * last step between delays keeps being added.
 */
public final class RetrySchedule
{
    private static final Duration MIN_EXTRAPOLATION_STEP = Duration.ofSeconds(1);

    private final int maxAttempts;
    private final List<Duration> delays;

    public RetrySchedule(int maxAttempts, List<Duration> delays) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(delays, "delays must not be null");
        if (delays.isEmpty()) {
            throw new IllegalArgumentException("delays must not be empty");
        }
        for (int i = 0; i < delays.size(); i++) {
            Duration d = Objects.requireNonNull(delays.get(i), "delays must not contain null");
            if (d.isNegative()) {
                throw new IllegalArgumentException("delay " + i + " is negative: " + d);
            }
            if (i > 0 && d.compareTo(delays.get(i - 1)) <= 0) {
                throw new IllegalArgumentException("delays must be strictly increasing: " + delays);
            }
        }
        this.maxAttempts = maxAttempts;
        this.delays = List.copyOf(delays);
    }

    public static RetrySchedule defaults() {
        return new RetrySchedule(3, List.of(Duration.ZERO, Duration.ofSeconds(2), Duration.ofSeconds(5)));
    }

    public static RetrySchedule from(CorrelatorCorrelationProperties props) {
        return new RetrySchedule(props.getMaxAttempts(), props.getDelays());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public List<Duration> getDelays() {
        return delays;
    }

    /**
     * @param attempt 1-based attempt number
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        if (attempt <= delays.size()) {
            return delays.get(attempt - 1);
        }
        Duration last = delays.get(delays.size() - 1);
        Duration step = delays.size() >= 2 ? last.minus(delays.get(delays.size() - 2)) : last;
        if (step.compareTo(MIN_EXTRAPOLATION_STEP) < 0) {
            step = MIN_EXTRAPOLATION_STEP;
        }
        return last.plus(step.multipliedBy(attempt - delays.size()));
    }

    @Override
    public String toString() {
        return "RetrySchedule{maxAttempts=" + maxAttempts + ", delays=" + delays + '}';
    }
}
