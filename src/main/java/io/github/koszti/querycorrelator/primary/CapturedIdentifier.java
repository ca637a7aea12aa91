package io.github.koszti.querycorrelator.primary;

/**
 * Identifier assigned by the primary channel, possibly empty.
 */
public record CapturedIdentifier(String value) {

    public CapturedIdentifier {
        value = value == null ? "" : value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
