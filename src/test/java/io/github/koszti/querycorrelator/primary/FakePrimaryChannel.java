package io.github.koszti.querycorrelator.primary;

import io.github.koszti.querycorrelator.MutableClock;
import io.github.koszti.querycorrelator.model.QueryRequest;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory primary channel with scripted identifier, shape and latency.
 */
public final class FakePrimaryChannel implements PrimaryChannel {

    private final String identifier;
    private final int rows;
    private final int columns;
    private final String submitFailure;
    private final Integer failAfterRows;
    private final AtomicInteger submits = new AtomicInteger();
    private MutableClock clock;
    private long handleLatencyMillis;
    private long perRowMillis;

    private FakePrimaryChannel(String identifier, int rows, int columns, String submitFailure, Integer failAfterRows) {
        this.identifier = identifier;
        this.rows = rows;
        this.columns = columns;
        this.submitFailure = submitFailure;
        this.failAfterRows = failAfterRows;
    }

    public static FakePrimaryChannel succeeding(String identifier, int rows, int columns) {
        return new FakePrimaryChannel(identifier, rows, columns, null, null);
    }

    /**
     * Delivers {@code identifier} (when not null) and then fails the submission.
     */
    public static FakePrimaryChannel failingOnSubmit(String identifier, String message) {
        return new FakePrimaryChannel(identifier, 0, 0, message, null);
    }

    /**
     * Submits fine, then fails while draining after {@code rowsBeforeFailure} rows.
     */
    public static FakePrimaryChannel failingOnDrain(String identifier, int rowsBeforeFailure, int columns) {
        return new FakePrimaryChannel(identifier, Integer.MAX_VALUE, columns, null, rowsBeforeFailure);
    }

    public FakePrimaryChannel withLatency(MutableClock clock, long handleLatencyMillis, long perRowMillis) {
        this.clock = clock;
        this.handleLatencyMillis = handleLatencyMillis;
        this.perRowMillis = perRowMillis;
        return this;
    }

    public int getSubmitCount() {
        return submits.get();
    }

    @Override
    public PrimaryResultHandle submit(QueryRequest request, IdentifierCaptureHook hook) throws SQLException {
        submits.incrementAndGet();
        if (clock != null) {
            clock.advanceMillis(handleLatencyMillis);
        }
        if (identifier != null) {
            hook.onIdentifier(identifier);
        }
        if (submitFailure != null) {
            throw new SQLException(submitFailure);
        }

        return new PrimaryResultHandle() {
            private int produced;

            @Override
            public int getColumnCount() {
                return columns;
            }

            @Override
            public boolean next() throws SQLException {
                if (failAfterRows != null && produced >= failAfterRows) {
                    throw new SQLException("connection reset while fetching");
                }
                if (produced >= rows) {
                    return false;
                }
                produced++;
                if (clock != null) {
                    clock.advanceMillis(perRowMillis);
                }
                return true;
            }

            @Override
            public void close() {
            }
        };
    }
}
