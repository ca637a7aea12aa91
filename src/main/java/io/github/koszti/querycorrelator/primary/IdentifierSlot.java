package io.github.koszti.querycorrelator.primary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-assignment slot for the identifier delivered through {@link IdentifierCaptureHook}.
 * <p>
 * The first non-blank identifier wins. Once {@link #seal()} has been called the slot no longer
 * accepts deliveries, so a reader that seals after the submit call returned sees a stable value
 * even if the driver delivers from another thread.
 */
public final class IdentifierSlot implements IdentifierCaptureHook {

    private static final Logger log = LoggerFactory.getLogger(IdentifierSlot.class);

    private final AtomicReference<String> value = new AtomicReference<>();
    private final AtomicBoolean sealed = new AtomicBoolean(false);

    @Override
    public void onIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return;
        }
        if (sealed.get()) {
            log.warn("Ignoring identifier {} delivered after the submit call returned", identifier);
            return;
        }
        if (!value.compareAndSet(null, identifier)) {
            log.warn("Ignoring second identifier {}; already captured {}", identifier, value.get());
            return;
        }
        log.debug("Captured primary identifier {}", identifier);
    }

    /**
     * Stops accepting deliveries and returns what was captured.
     */
    public CapturedIdentifier seal() {
        sealed.set(true);
        return new CapturedIdentifier(value.get());
    }

    public boolean isSealed() {
        return sealed.get();
    }
}
