package io.github.koszti.querycorrelator.correlation;

import io.github.koszti.querycorrelator.config.CorrelatorCorrelationProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryScheduleTest {

    @Test
    void defaultsAreImmediateThenTwoThenFiveSeconds() {
        RetrySchedule schedule = RetrySchedule.defaults();

        assertEquals(3, schedule.getMaxAttempts());
        assertEquals(Duration.ZERO, schedule.delayBefore(1));
        assertEquals(Duration.ofSeconds(2), schedule.delayBefore(2));
        assertEquals(Duration.ofSeconds(5), schedule.delayBefore(3));
    }

    @Test
    void extrapolatesWithLastStep() {
        RetrySchedule schedule = new RetrySchedule(5,
                List.of(Duration.ZERO, Duration.ofSeconds(2), Duration.ofSeconds(5)));

        assertEquals(Duration.ofSeconds(8), schedule.delayBefore(4));
        assertEquals(Duration.ofSeconds(11), schedule.delayBefore(5));
    }

    @Test
    void singleZeroDelayExtrapolatesByOneSecond() {
        RetrySchedule schedule = new RetrySchedule(3, List.of(Duration.ZERO));

        assertEquals(Duration.ofSeconds(1), schedule.delayBefore(2));
        assertEquals(Duration.ofSeconds(2), schedule.delayBefore(3));
    }

    @Test
    void rejectsInvalidSchedules() {
        assertThrows(IllegalArgumentException.class, () -> new RetrySchedule(0, List.of(Duration.ZERO)));
        assertThrows(IllegalArgumentException.class, () -> new RetrySchedule(3, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new RetrySchedule(3, List.of(Duration.ofSeconds(2), Duration.ofSeconds(2))));
        assertThrows(IllegalArgumentException.class,
                () -> new RetrySchedule(3, List.of(Duration.ofSeconds(-1))));
        assertThrows(IllegalArgumentException.class, () -> RetrySchedule.defaults().delayBefore(0));
    }

    @Test
    void buildsFromProperties() {
        CorrelatorCorrelationProperties props = new CorrelatorCorrelationProperties();
        props.setMaxAttempts(4);
        props.setDelays(List.of(Duration.ofMillis(100), Duration.ofMillis(500)));

        RetrySchedule schedule = RetrySchedule.from(props);

        assertEquals(4, schedule.getMaxAttempts());
        assertEquals(Duration.ofMillis(100), schedule.delayBefore(1));
        assertEquals(Duration.ofMillis(1500), schedule.delayBefore(3));
    }
}
