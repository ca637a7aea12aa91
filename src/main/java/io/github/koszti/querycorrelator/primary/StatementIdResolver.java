package io.github.koszti.querycorrelator.primary;

import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Reads the server-assigned statement id from driver objects.
 */
@FunctionalInterface
public interface StatementIdResolver {

    /**
     * @param resultSet null when the submission failed before a result existed
     * @return the id, or null when the driver does not expose one
     */
    String resolve(Statement statement, ResultSet resultSet);
}
