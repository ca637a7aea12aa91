package io.github.koszti.querycorrelator.correlation;

import java.util.Objects;

/**
 * One lookup call made by the correlation loop. Kept only for diagnostics.
 *
 * @param attemptNumber 1-based
 * @param issuedAtMillis epoch milliseconds when the lookup was issued
 * @param outcome classification of the call
 * @param detail server state or error message, may be null
 */
public record CorrelationAttempt(int attemptNumber, long issuedAtMillis, LookupOutcome outcome, String detail) {

    public CorrelationAttempt {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(outcome, "outcome must not be null");
    }
}
