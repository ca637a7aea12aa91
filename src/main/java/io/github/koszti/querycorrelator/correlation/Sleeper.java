package io.github.koszti.querycorrelator.correlation;

import java.time.Duration;

/**
 * Waits between correlation attempts. Waiting must be interruptible.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
