package io.notify4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.DispatchListener;
import io.notify4j.NotificationDispatcher;
import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.InvalidScheduleFormatException;
import io.notify4j.core.RescheduleResult;
import io.notify4j.core.SchedulerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultNotificationSchedulerTest {

    private MutableClock clock;
    private InMemoryTriggerStore store;
    private List<String> dispatched;
    private DefaultNotificationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryTriggerStore(clock);
        dispatched = new CopyOnWriteArrayList<>();
        scheduler = newScheduler(false, Duration.ofMinutes(10));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void armedNoteShouldFireOnceAfterItsTime() throws Exception {
        scheduler.arm("note-1", "09:00", Map.of("title", "Standup"));
        assertEquals(Instant.parse("2026-03-10T09:00:00Z"), scheduler.find("note-1").orElseThrow().nextFireAt());

        scheduler.start();
        clock.set(Instant.parse("2026-03-10T09:01:00Z"));
        scheduler.pollNow();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> dispatched.size() == 1));
        assertEquals(List.of("note-1:Standup"), dispatched);
        assertTrue(scheduler.find("note-1").isEmpty());

        clock.advance(Duration.ofDays(1));
        assertEquals(0, scheduler.pollNow());
    }

    @Test
    void pollerShouldFireWithoutManualPoll() throws Exception {
        scheduler = newScheduler(false, Duration.ofMillis(50));
        scheduler.start();
        scheduler.arm("note-1", "09:00", Map.of("title", "Standup"));

        clock.set(Instant.parse("2026-03-10T09:00:30Z"));

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> dispatched.size() == 1));
    }

    @Test
    void pollWhileStoppedShouldLeaveTriggerArmed() {
        String key = scheduler.arm("note-1", "09:00", Map.of("title", "Standup"));
        clock.set(Instant.parse("2026-03-10T09:01:00Z"));

        assertEquals(0, scheduler.pollNow());

        assertEquals(key, scheduler.find("note-1").orElseThrow().triggerKey());
        assertTrue(scheduler.failedDispatches().isEmpty());
        assertTrue(dispatched.isEmpty());
    }

    @Test
    void dueTriggerShouldFireOnceAcrossStopAndRestart() throws Exception {
        scheduler.start();
        scheduler.arm("note-1", "09:00", Map.of("title", "Standup"));
        scheduler.stop();
        assertFalse(scheduler.isRunning());

        clock.set(Instant.parse("2026-03-10T09:01:00Z"));
        assertEquals(0, scheduler.pollNow());
        assertTrue(scheduler.find("note-1").isPresent());

        scheduler.start();
        assertTrue(scheduler.isRunning());

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> dispatched.size() == 1));
        assertEquals(0, scheduler.pollNow());
        assertEquals(List.of("note-1:Standup"), dispatched);
        assertTrue(scheduler.find("note-1").isEmpty());
    }

    @Test
    void cancelledTriggerShouldNeverFire() {
        String key = scheduler.arm("note-1", "09:00", null);

        assertTrue(scheduler.cancel(key));
        assertFalse(scheduler.cancel(key));

        scheduler.start();
        clock.set(Instant.parse("2026-03-10T10:00:00Z"));
        assertEquals(0, scheduler.pollNow());
    }

    @Test
    void rescheduleShouldReplaceTriggerAndDescribeIt() {
        String original = scheduler.arm("note-1", "09:00", null);

        RescheduleResult result = scheduler.reschedule("note-1", "18:30", null);

        assertEquals(RescheduleResult.UPDATED_MESSAGE, result.message());
        assertEquals("18:30", result.schedule());
        ArmedTrigger current = scheduler.find("note-1").orElseThrow();
        assertEquals(result.jobId(), current.triggerKey());
        assertEquals(Instant.parse("2026-03-10T18:30:00Z"), current.nextFireAt());
        assertFalse(scheduler.cancel(original));
    }

    @Test
    void armShouldRejectMalformedScheduleWithoutTouchingStore() {
        String key = scheduler.arm("note-1", "09:00");

        assertThrows(InvalidScheduleFormatException.class, () -> scheduler.arm("note-1", "9:00"));
        assertEquals(key, scheduler.find("note-1").orElseThrow().triggerKey());
    }

    @Test
    void strictModeShouldRejectOutOfRangeSchedule() {
        DefaultNotificationScheduler strict = newScheduler(true, Duration.ofMinutes(10));

        assertThrows(InvalidScheduleFormatException.class, () -> strict.arm("note-1", "25:00"));
        assertTrue(store.get("note-1").isEmpty());

        scheduler.arm("note-2", "25:00");
        assertEquals(Instant.parse("2026-03-11T01:00:00Z"), scheduler.find("note-2").orElseThrow().nextFireAt());
    }

    @Test
    void failedDispatchShouldBeExposedAndNotRetried() throws Exception {
        scheduler = new DefaultNotificationScheduler(
                options(false, Duration.ofMinutes(10)),
                store,
                new FailingDispatcher(),
                new DispatchListener() {
                },
                new ObjectMapper(),
                clock
        );
        scheduler.arm("note-1", "09:00");
        scheduler.start();
        clock.set(Instant.parse("2026-03-10T09:00:00Z"));
        scheduler.pollNow();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> scheduler.failedDispatches().size() == 1));
        assertTrue(scheduler.find("note-1").isEmpty());
        assertEquals(0, scheduler.pollNow());
        assertEquals(1, scheduler.failedDispatches().size());
    }

    private DefaultNotificationScheduler newScheduler(boolean strict, Duration pollEvery) {
        return new DefaultNotificationScheduler(
                options(strict, pollEvery),
                store,
                new TitleDispatcher(dispatched),
                new LoggingDispatchListener(),
                new ObjectMapper(),
                clock
        );
    }

    private static SchedulerOptions options(boolean strict, Duration pollEvery) {
        return new SchedulerOptions(pollEvery, 2, 10, strict);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    static class TitleDispatcher implements NotificationDispatcher<Map<String, Object>> {
        private final List<String> sink;

        TitleDispatcher(List<String> sink) {
            this.sink = sink;
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> payloadClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public void dispatch(String subjectId, Map<String, Object> payload) {
            sink.add(subjectId + ":" + (payload == null ? null : payload.get("title")));
        }
    }

    static class FailingDispatcher implements NotificationDispatcher<Object> {
        @Override
        public Class<Object> payloadClass() {
            return Object.class;
        }

        @Override
        public void dispatch(String subjectId, Object payload) throws Exception {
            throw new java.io.IOException("mail relay unreachable");
        }
    }
}
