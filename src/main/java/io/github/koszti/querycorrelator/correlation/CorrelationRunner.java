package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.compare.ComparisonReporter;
import io.github.koszti.querycorrelator.compare.ComparisonResult;
import io.github.koszti.querycorrelator.config.CorrelatorRunProperties;
import io.github.koszti.querycorrelator.model.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Correlates the configured SQL once at startup when {@code correlator.run.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "correlator.run", name = "enabled", havingValue = "true")
public class CorrelationRunner
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(CorrelationRunner.class);

    private final CorrelationService correlationService;
    private final ComparisonReporter reporter;
    private final CorrelatorRunProperties runProps;

    public CorrelationRunner(CorrelationService correlationService,
            ComparisonReporter reporter,
            CorrelatorRunProperties runProps) {
        this.correlationService = correlationService;
        this.reporter = reporter;
        this.runProps = runProps;
    }

    @Override
    public void run(String... args) {
        QueryRequest request = QueryRequest.of(runProps.getSql());
        log.info("Correlating: {}", request.sql());

        ComparisonResult correlated = correlationService.correlate(request);
        reporter.report(correlated);

        if (runProps.isIndependent()) {
            log.info("Executing independently through the telemetry API for comparison");
            ComparisonResult independent = correlationService.compareIndependently(request);
            reporter.report(independent);
        }
    }
}
