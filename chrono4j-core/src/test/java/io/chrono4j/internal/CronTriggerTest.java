package io.chrono4j.internal;

import io.chrono4j.logging.NopJobLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronTriggerTest {

    private final List<String> fired = new CopyOnWriteArrayList<>();
    private final CronTrigger trigger = new CronTrigger(fired::add, ZoneId.of("UTC"), NopJobLogger.INSTANCE);

    @AfterEach
    void tearDown() {
        trigger.stop();
    }

    @Test
    void armedJobShouldFireRepeatedly() {
        trigger.start();
        Instant first = trigger.schedule("every-second", "* * * * * *");

        assertThat(first).isAfter(Instant.now().minusMillis(1));
        await().atMost(Duration.ofSeconds(4)).until(() -> fired.size() >= 2);
        assertThat(fired).containsOnly("every-second");
        assertTrue(trigger.isScheduled("every-second"));
    }

    @Test
    void cancelledJobShouldNotFire() throws InterruptedException {
        trigger.start();
        trigger.schedule("a", "* * * * * *");
        assertTrue(trigger.cancel("a"));
        assertFalse(trigger.cancel("a"));

        Thread.sleep(1500);
        assertThat(fired).isEmpty();
        assertNull(trigger.nextFireTime("a"));
    }

    @Test
    void reschedulingShouldReplacePreviousFiring() {
        Instant hourly = trigger.schedule("a", "0 * * * *");
        assertEquals(hourly, trigger.nextFireTime("a"));

        Instant daily = trigger.schedule("a", "0 0 * * *");
        assertEquals(daily, trigger.nextFireTime("a"));
        assertEquals(1, trigger.size());
    }

    @Test
    void invalidExpressionShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> trigger.schedule("a", "nope"));
        assertFalse(trigger.isScheduled("a"));
    }

    @Test
    void stopShouldDisarmEverything() {
        trigger.start();
        trigger.schedule("a", "0 * * * *");
        trigger.schedule("b", "0 0 * * *");

        trigger.stop();

        assertEquals(0, trigger.size());
    }
}
