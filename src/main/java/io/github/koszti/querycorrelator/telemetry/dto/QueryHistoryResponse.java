package io.github.koszti.querycorrelator.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code GET /api/2.0/sql/history/queries/{id}}.
 * Timestamps are epoch milliseconds; {@code duration} is the server's own total and is only
 * used to cross-check the computed one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryHistoryResponse
{
    @JsonProperty("query_id")
    private String queryId;
    private String status; // QUEUED, RUNNING, CANCELED, FAILED, FINISHED
    @JsonProperty("query_text")
    private String queryText;
    @JsonProperty("warehouse_id")
    private String warehouseId;
    @JsonProperty("query_start_time_ms")
    private Long queryStartTimeMs;
    @JsonProperty("execution_end_time_ms")
    private Long executionEndTimeMs;
    @JsonProperty("query_end_time_ms")
    private Long queryEndTimeMs;
    private Long duration;
    @JsonProperty("rows_produced")
    private Long rowsProduced;
    @JsonProperty("error_message")
    private String errorMessage;
    @JsonProperty("client_application")
    private String clientApplication;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public String getWarehouseId() {
        return warehouseId;
    }

    public void setWarehouseId(String warehouseId) {
        this.warehouseId = warehouseId;
    }

    public Long getQueryStartTimeMs() {
        return queryStartTimeMs;
    }

    public void setQueryStartTimeMs(Long queryStartTimeMs) {
        this.queryStartTimeMs = queryStartTimeMs;
    }

    public Long getExecutionEndTimeMs() {
        return executionEndTimeMs;
    }

    public void setExecutionEndTimeMs(Long executionEndTimeMs) {
        this.executionEndTimeMs = executionEndTimeMs;
    }

    public Long getQueryEndTimeMs() {
        return queryEndTimeMs;
    }

    public void setQueryEndTimeMs(Long queryEndTimeMs) {
        this.queryEndTimeMs = queryEndTimeMs;
    }

    public Long getDuration() {
        return duration;
    }

    public void setDuration(Long duration) {
        this.duration = duration;
    }

    public Long getRowsProduced() {
        return rowsProduced;
    }

    public void setRowsProduced(Long rowsProduced) {
        this.rowsProduced = rowsProduced;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getClientApplication() {
        return clientApplication;
    }

    public void setClientApplication(String clientApplication) {
        this.clientApplication = clientApplication;
    }
}
