package io.github.koszti.querycorrelator.primary;

import io.github.koszti.querycorrelator.config.CorrelatorPrimaryProperties;
import io.github.koszti.querycorrelator.model.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Primary channel over a JDBC driver. Every submission opens its own connection, which is
 * closed together with the returned handle.
 */
@Component
public class JdbcPrimaryChannel implements PrimaryChannel
{
    private static final Logger log = LoggerFactory.getLogger(JdbcPrimaryChannel.class);

    private final CorrelatorPrimaryProperties primaryProps;
    private final StatementIdResolver statementIdResolver;

    public JdbcPrimaryChannel(CorrelatorPrimaryProperties primaryProps,
            StatementIdResolver statementIdResolver) {
        this.primaryProps = primaryProps;
        this.statementIdResolver = statementIdResolver;
    }

    @Override
    public PrimaryResultHandle submit(QueryRequest request, IdentifierCaptureHook hook) throws SQLException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(hook, "hook must not be null");

        Connection connection = DriverManager.getConnection(primaryProps.getJdbcUrl(), connectionProperties());
        Statement statement = null;
        try {
            statement = connection.createStatement();
            statement.setFetchSize(primaryProps.getFetchSize());
            int timeoutSeconds = toTimeoutSeconds(primaryProps.getQueryTimeout());
            if (timeoutSeconds > 0) {
                statement.setQueryTimeout(timeoutSeconds);
            }

            log.debug("Submitting query over JDBC: {}", request.sql());

            ResultSet resultSet;
            try {
                resultSet = statement.executeQuery(request.sql());
            } catch (SQLException e) {
                // some drivers assign the id before the failure surfaces
                deliverIdentifier(hook, statement, null);
                throw e;
            }
            deliverIdentifier(hook, statement, resultSet);
            return new JdbcResultHandle(connection, statement, resultSet);
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(e, statement, connection);
            throw e;
        }
    }

    private void deliverIdentifier(IdentifierCaptureHook hook, Statement statement, ResultSet resultSet) {
        String id = statementIdResolver.resolve(statement, resultSet);
        if (id != null) {
            hook.onIdentifier(id);
        } else {
            log.debug("Driver did not expose a statement id");
        }
    }

    private Properties connectionProperties() {
        Properties properties = new Properties();
        properties.putAll(primaryProps.getProperties());
        if (primaryProps.getUser() != null && !primaryProps.getUser().isBlank()) {
            properties.setProperty("user", primaryProps.getUser());
        }
        if (primaryProps.getPassword() != null && !primaryProps.getPassword().isBlank()) {
            properties.setProperty("password", primaryProps.getPassword());
        }
        return properties;
    }

    static int toTimeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }

    private static void closeAfterFailure(Exception failure, AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            } catch (Exception e) {
                failure.addSuppressed(e);
            }
        }
    }

    private static final class JdbcResultHandle implements PrimaryResultHandle {
        private final Connection connection;
        private final Statement statement;
        private final ResultSet resultSet;
        private int columnCount = -1;

        private JdbcResultHandle(Connection connection, Statement statement, ResultSet resultSet) {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;
        }

        @Override
        public int getColumnCount() throws SQLException {
            if (columnCount < 0) {
                columnCount = resultSet.getMetaData().getColumnCount();
            }
            return columnCount;
        }

        @Override
        public boolean next() throws SQLException {
            if (!resultSet.next()) {
                return false;
            }
            int columns = getColumnCount();
            for (int i = 1; i <= columns; i++) {
                resultSet.getObject(i);
            }
            return true;
        }

        @Override
        public void close() throws SQLException {
            try (Connection c = connection; Statement s = statement; ResultSet r = resultSet) {
                // closed in reverse order
            }
        }
    }
}
