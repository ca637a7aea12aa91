package io.github.koszti.querycorrelator.config;

import io.github.koszti.querycorrelator.compare.ExecutionComparator;
import io.github.koszti.querycorrelator.correlation.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CorrelationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public ExecutionComparator executionComparator(CorrelatorCorrelationProperties props) {
        return new ExecutionComparator(props.getDurationBasis());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService correlationExecutor(CorrelatorCorrelationProperties props) {
        return Executors.newFixedThreadPool(props.getParallelism());
    }
}
