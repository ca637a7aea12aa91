package io.github.koszti.querycorrelator.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned with non-2xx responses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryErrorResponse
{
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
