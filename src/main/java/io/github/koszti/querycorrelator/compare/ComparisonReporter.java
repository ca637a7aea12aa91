package io.github.koszti.querycorrelator.compare;

import io.github.koszti.querycorrelator.model.ExecutionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs comparison results and renders them as JSON.
 */
@Component
public class ComparisonReporter
{
    private static final Logger log = LoggerFactory.getLogger(ComparisonReporter.class);

    private final ObjectMapper objectMapper;

    public ComparisonReporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void report(ComparisonResult result) {
        log.info("{}", summarize(result));
        if (log.isDebugEnabled()) {
            log.debug("Full comparison:\n{}", toJson(result));
        }
    }

    public String summarize(ComparisonResult result) {
        ExecutionRecord p = result.primary();
        ExecutionRecord t = result.telemetry();
        StringBuilder sb = new StringBuilder();
        sb.append(result.mode()).append(' ').append(result.status())
                .append(" after ").append(result.correlationAttempts()).append(" attempt(s)");
        sb.append(" | primary ").append(describe(p));
        sb.append(" | telemetry ").append(t != null ? describe(t) : "(none)");
        sb.append(" | delta ").append(result.durationDelta().map(d -> d + "ms").orElse("unavailable"))
                .append(" (").append(result.durationBasis()).append(')');
        sb.append(" | rows ").append(result.rowCountAgreement() ? "agree" : "MISMATCH");
        sb.append(", columns ").append(result.columnCountAgreement() ? "agree" : "MISMATCH");
        if (result.correlation().failureMessage() != null) {
            sb.append(" | ").append(result.correlation().failureMessage());
        }
        return sb.toString();
    }

    public String toJson(ComparisonResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to render comparison result as JSON", e);
        }
    }

    private static String describe(ExecutionRecord r) {
        return (r.hasIdentifier() ? r.getIdentifier() : "(no id)")
                + " " + r.getStatus()
                + " " + (r.getDurationMillis() != null ? r.getDurationMillis() + "ms" : "n/a")
                + " " + r.getRowCount() + " rows/" + r.getColumnCount() + " cols";
    }
}
