package io.github.koszti.querycorrelator.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/2.0/sql/statements/}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatementExecutionRequest
{
    private String statement;
    @JsonProperty("warehouse_id")
    private String warehouseId;
    @JsonProperty("wait_timeout")
    private String waitTimeout; // e.g. "30s"
    @JsonProperty("on_wait_timeout")
    private String onWaitTimeout; // CONTINUE or CANCEL
    private String format;
    private String disposition;

    public String getStatement() {
        return statement;
    }

    public void setStatement(String statement) {
        this.statement = statement;
    }

    public String getWarehouseId() {
        return warehouseId;
    }

    public void setWarehouseId(String warehouseId) {
        this.warehouseId = warehouseId;
    }

    public String getWaitTimeout() {
        return waitTimeout;
    }

    public void setWaitTimeout(String waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    public String getOnWaitTimeout() {
        return onWaitTimeout;
    }

    public void setOnWaitTimeout(String onWaitTimeout) {
        this.onWaitTimeout = onWaitTimeout;
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
