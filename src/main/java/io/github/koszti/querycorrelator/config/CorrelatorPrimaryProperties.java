package io.github.koszti.querycorrelator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "correlator.primary")
public class CorrelatorPrimaryProperties {

    /**
     * JDBC URL of the SQL warehouse, e.g.
     * jdbc:databricks://host:443/default;transportMode=http;ssl=1;httpPath=/sql/1.0/warehouses/abc
     */
    private String jdbcUrl = "jdbc:databricks://localhost:443/default";

    /**
     * JDBC user. Personal access tokens use the literal user "token".
     */
    private String user = "token";

    /**
     * JDBC password, typically the personal access token.
     */
    private String password;

    /**
     * Rows fetched per round trip while draining results.
     */
    private int fetchSize = 1000;

    /**
     * Per-statement timeout handed to the driver. Rounded up to whole seconds.
     */
    private Duration queryTimeout = Duration.ofSeconds(60);

    /**
     * No-arg method returning the server statement id, looked up on the driver's
     * result set and statement implementations.
     */
    private String statementIdMethod = "getStatementId";

    /**
     * Extra driver properties passed to DriverManager as-is.
     */
    private Map<String, String> properties = new LinkedHashMap<>();

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getFetchSize() {
        return Math.max(1, fetchSize);
    }

    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public String getStatementIdMethod() {
        return statementIdMethod;
    }

    public void setStatementIdMethod(String statementIdMethod) {
        this.statementIdMethod = statementIdMethod;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, String> properties) {
        this.properties = properties;
    }
}
