package io.github.koszti.querycorrelator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "correlator.telemetry")
public class CorrelatorTelemetryProperties {

    /**
     * Workspace base URL, e.g. https://my-workspace.cloud.databricks.com
     */
    private String baseUrl = "https://localhost";

    /**
     * Bearer token sent in the Authorization header.
     */
    private String token;

    /**
     * Default SQL warehouse for statement submissions.
     */
    private String warehouseId;

    /**
     * TCP connect timeout for telemetry calls.
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Read timeout of a single telemetry call. Must exceed {@link #waitTimeout}.
     */
    private Duration requestTimeout = Duration.ofSeconds(60);

    /**
     * How long a statement submission blocks server-side before returning.
     * The API accepts 5s to 50s; values are clamped into that range.
     */
    private Duration waitTimeout = Duration.ofSeconds(30);

    /**
     * Interval between status polls of a submitted statement that is still running.
     */
    private Duration pollInterval = Duration.ofMillis(500);

    /**
     * Result format for statement submissions.
     */
    private String format = "JSON_ARRAY";

    /**
     * Result disposition for statement submissions.
     */
    private String disposition = "INLINE";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getWarehouseId() {
        return warehouseId;
    }

    public void setWarehouseId(String warehouseId) {
        this.warehouseId = warehouseId;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public void setWaitTimeout(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getDisposition() {
        return disposition;
    }

    public void setDisposition(String disposition) {
        this.disposition = disposition;
    }
}
