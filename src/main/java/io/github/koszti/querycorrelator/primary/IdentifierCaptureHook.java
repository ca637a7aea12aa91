package io.github.koszti.querycorrelator.primary;

/**
 * Receives the identifier the primary channel assigns to a submitted query.
 * Called at most once per submission, before the submit call returns.
 */
@FunctionalInterface
public interface IdentifierCaptureHook {

    void onIdentifier(String identifier);
}
