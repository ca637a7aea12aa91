package io.github.koszti.querycorrelator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ConfigLogger
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(ConfigLogger.class);

    private final CorrelatorPrimaryProperties primaryProps;
    private final CorrelatorTelemetryProperties telemetryProps;
    private final CorrelatorCorrelationProperties correlationProps;

    public ConfigLogger(CorrelatorPrimaryProperties primaryProps,
            CorrelatorTelemetryProperties telemetryProps,
            CorrelatorCorrelationProperties correlationProps) {
        this.primaryProps = primaryProps;
        this.telemetryProps = telemetryProps;
        this.correlationProps = correlationProps;
    }

    @Override
    public void run(String... args)
    {
        log.info("JDBC URL            : {}", primaryProps.getJdbcUrl());
        log.info("JDBC user           : {}", primaryProps.getUser());
        log.info("JDBC query timeout  : {}", primaryProps.getQueryTimeout());
        log.info("Telemetry base URL  : {}", telemetryProps.getBaseUrl());
        log.info("Telemetry token     : {}", mask(telemetryProps.getToken()));
        log.info("Warehouse id        : {}", telemetryProps.getWarehouseId());
        log.info("Telemetry timeouts  : connect={}, request={}, wait={}",
                telemetryProps.getConnectTimeout(), telemetryProps.getRequestTimeout(), telemetryProps.getWaitTimeout());
        log.info("Lookup attempts     : {}", correlationProps.getMaxAttempts());
        log.info("Lookup delays       : {}", correlationProps.getDelays());
        log.info("Correlation deadline: {}", correlationProps.getDeadline());
        log.info("Duration basis      : {}", correlationProps.getDurationBasis());
    }

    static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "(not set)";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "****";
    }
}
