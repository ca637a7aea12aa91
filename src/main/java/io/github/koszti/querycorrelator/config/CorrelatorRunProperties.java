package io.github.koszti.querycorrelator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "correlator.run")
public class CorrelatorRunProperties {

    /**
     * Run one correlation at startup.
     */
    private boolean enabled = false;

    /**
     * SQL to correlate at startup.
     */
    private String sql = "SELECT current_timestamp() AS query_time, 'query_timing_correlator' AS message";

    /**
     * Also execute the SQL independently through the telemetry API and compare side by side.
     */
    private boolean independent = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public boolean isIndependent() {
        return independent;
    }

    public void setIndependent(boolean independent) {
        this.independent = independent;
    }
}
