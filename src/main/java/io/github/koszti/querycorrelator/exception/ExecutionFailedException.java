package io.github.koszti.querycorrelator.exception;

import io.github.koszti.querycorrelator.model.ExecutionRecord;

import java.util.Objects;

/**
 * The primary channel could not complete a query.
 * <p>
 * The attached record has status FAILED and still carries the identifier when the driver
 * assigned one before failing: identifier capture and execution success are independent.
 */
public class ExecutionFailedException extends Exception {

    private final ExecutionRecord record;

    public ExecutionFailedException(String message, ExecutionRecord record, Throwable cause) {
        super(message, cause);
        this.record = Objects.requireNonNull(record, "record must not be null");
    }

    public ExecutionRecord getRecord() {
        return record;
    }

    public String getIdentifier() {
        return record.getIdentifier();
    }

    public CorrelationErrorKind getKind() {
        return CorrelationErrorKind.EXECUTION_FAILED;
    }
}
