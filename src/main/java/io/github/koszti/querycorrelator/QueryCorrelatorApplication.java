package io.github.koszti.querycorrelator;

import io.github.koszti.querycorrelator.config.CorrelatorCorrelationProperties;
import io.github.koszti.querycorrelator.config.CorrelatorPrimaryProperties;
import io.github.koszti.querycorrelator.config.CorrelatorRunProperties;
import io.github.koszti.querycorrelator.config.CorrelatorTelemetryProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
		CorrelatorPrimaryProperties.class,
		CorrelatorTelemetryProperties.class,
		CorrelatorCorrelationProperties.class,
		CorrelatorRunProperties.class
})
public class QueryCorrelatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(QueryCorrelatorApplication.class, args);
	}

}
