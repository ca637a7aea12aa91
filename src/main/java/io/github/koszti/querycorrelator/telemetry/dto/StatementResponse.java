package io.github.koszti.querycorrelator.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal view of the statement execution API response, shared by the submit call and
 * {@code GET /api/2.0/sql/statements/{id}}. Result data is not read; only the manifest counts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementResponse
{
    @JsonProperty("statement_id")
    private String statementId;
    private Status status;
    private Manifest manifest;

    public String getStatementId() {
        return statementId;
    }

    public void setStatementId(String statementId) {
        this.statementId = statementId;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public void setManifest(Manifest manifest) {
        this.manifest = manifest;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        private String state; // PENDING, RUNNING, SUCCEEDED, FAILED, CANCELED, CLOSED
        private StatementError error;

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public StatementError getError() {
            return error;
        }

        public void setError(StatementError error) {
            this.error = error;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatementError {
        @JsonProperty("error_code")
        private String errorCode;
        private String message;

        public String getErrorCode() {
            return errorCode;
        }

        public void setErrorCode(String errorCode) {
            this.errorCode = errorCode;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Manifest {
        private String format;
        private Schema schema;
        @JsonProperty("total_chunk_count")
        private Integer totalChunkCount;
        @JsonProperty("total_row_count")
        private Long totalRowCount;

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public Schema getSchema() {
            return schema;
        }

        public void setSchema(Schema schema) {
            this.schema = schema;
        }

        public Integer getTotalChunkCount() {
            return totalChunkCount;
        }

        public void setTotalChunkCount(Integer totalChunkCount) {
            this.totalChunkCount = totalChunkCount;
        }

        public Long getTotalRowCount() {
            return totalRowCount;
        }

        public void setTotalRowCount(Long totalRowCount) {
            this.totalRowCount = totalRowCount;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Schema {
        @JsonProperty("column_count")
        private Integer columnCount;

        public Integer getColumnCount() {
            return columnCount;
        }

        public void setColumnCount(Integer columnCount) {
            this.columnCount = columnCount;
        }
    }
}
