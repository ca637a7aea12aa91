package io.github.koszti.querycorrelator.primary;

import java.sql.SQLException;

/**
 * Open result of a submitted query. Closing it releases the remote resource.
 */
public interface PrimaryResultHandle extends AutoCloseable {

    int getColumnCount() throws SQLException;

    /**
     * Advances to the next row, reading it fully.
     *
     * @return false once the result is drained
     */
    boolean next() throws SQLException;

    @Override
    void close() throws SQLException;
}
