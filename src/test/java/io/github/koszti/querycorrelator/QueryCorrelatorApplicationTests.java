package io.github.koszti.querycorrelator;

import io.github.koszti.querycorrelator.correlation.CorrelationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = {
        "correlator.run.enabled=false",
        "correlator.telemetry.base-url=http://127.0.0.1:9"
})
class QueryCorrelatorApplicationTests {

    @Autowired
    private CorrelationService correlationService;

    @Test
    void contextLoads() {
        assertNotNull(correlationService);
    }
}
