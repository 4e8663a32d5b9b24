package io.notify4j.internal;

import io.notify4j.core.DailyTime;
import io.notify4j.core.FireEvent;
import io.notify4j.core.FireEventChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerSchedulerTest {

    private MutableClock clock;
    private InMemoryTriggerStore store;
    private List<FireEvent> published;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryTriggerStore(clock);
        published = new CopyOnWriteArrayList<>();
    }

    @Test
    void pollOnceShouldPublishOneEventPerDueTrigger() {
        TriggerScheduler scheduler = new TriggerScheduler(store, published::add, clock, Duration.ofSeconds(1));
        String key = store.arm("note-1", "payload", new DailyTime(9, 0));
        store.arm("note-2", null, new DailyTime(10, 0));

        assertEquals(0, scheduler.pollOnce());

        clock.set(Instant.parse("2026-03-10T09:01:00Z"));
        assertEquals(1, scheduler.pollOnce());

        FireEvent event = published.get(0);
        assertEquals(key, event.triggerKey());
        assertEquals("note-1", event.subjectId());
        assertEquals("payload", event.payload());
        assertEquals(Instant.parse("2026-03-10T09:00:00Z"), event.scheduledFor());
        assertEquals(Instant.parse("2026-03-10T09:01:00Z"), event.firedAt());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(0, scheduler.pollOnce());
        assertEquals(1, published.size());
    }

    @Test
    void failedHandoffShouldLoseTheFiring() {
        TriggerScheduler scheduler = new TriggerScheduler(store, event -> {
            throw new IllegalStateException("channel closed");
        }, clock, Duration.ofSeconds(1));
        store.arm("note-1", null, new DailyTime(9, 0));
        clock.set(Instant.parse("2026-03-10T09:00:00Z"));

        assertEquals(0, scheduler.pollOnce());
        assertTrue(store.get("note-1").isEmpty());
        assertEquals(0, scheduler.pollOnce());
    }

    @Test
    void pollOnceShouldNotClaimWhileChannelIsClosed() {
        FireEventChannel closed = new FireEventChannel() {
            @Override
            public void publish(FireEvent event) {
                published.add(event);
            }

            @Override
            public boolean isAccepting() {
                return false;
            }
        };
        TriggerScheduler scheduler = new TriggerScheduler(store, closed, clock, Duration.ofSeconds(1));
        String key = store.arm("note-1", null, new DailyTime(9, 0));
        clock.set(Instant.parse("2026-03-10T09:01:00Z"));

        assertEquals(0, scheduler.pollOnce());

        assertTrue(published.isEmpty());
        assertEquals(key, store.get("note-1").orElseThrow().triggerKey());
    }

    @Test
    void stopShouldWaitForPollInProgress() throws Exception {
        CountDownLatch publishing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<FireEvent> handedOff = new CopyOnWriteArrayList<>();
        TriggerScheduler scheduler = new TriggerScheduler(store, event -> {
            publishing.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            handedOff.add(event);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }, clock, Duration.ofMinutes(5));
        store.arm("note-1", null, new DailyTime(9, 0));
        clock.set(Instant.parse("2026-03-10T09:00:00Z"));

        scheduler.start();
        assertTrue(publishing.await(5, TimeUnit.SECONDS));

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();
        scheduler.stop();

        assertEquals(1, handedOff.size());
        releaser.join();
    }

    @Test
    void runningSchedulerShouldFireWhenWoken() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        TriggerScheduler scheduler = new TriggerScheduler(store, event -> fired.countDown(), clock, Duration.ofMinutes(5));
        store.arm("note-1", null, new DailyTime(9, 0));

        scheduler.start();
        try {
            assertTrue(scheduler.isRunning());
            clock.set(Instant.parse("2026-03-10T09:00:00Z"));
            scheduler.wake();

            assertTrue(fired.await(5, TimeUnit.SECONDS));
        } finally {
            scheduler.stop();
        }
        assertFalse(scheduler.isRunning());
    }

    @Test
    void backoffShouldDoubleAndCap() {
        assertEquals(Duration.ofSeconds(1), TriggerScheduler.backoff(1));
        assertEquals(Duration.ofSeconds(2), TriggerScheduler.backoff(2));
        assertEquals(Duration.ofSeconds(32), TriggerScheduler.backoff(6));
        assertEquals(Duration.ofSeconds(60), TriggerScheduler.backoff(20));
    }
}
