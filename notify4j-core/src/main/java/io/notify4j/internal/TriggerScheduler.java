package io.notify4j.internal;

import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.FireEvent;
import io.notify4j.core.FireEventChannel;
import io.notify4j.core.TriggerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claims due triggers from a {@link TriggerStore} and turns each into exactly one
 * {@link FireEvent} on the worker channel.
 *
 * <p>Handoff is at-most-once: a claimed trigger is gone from the store, so if publishing fails
 * (or the process dies between claim and publish) that firing is lost.
 */
public class TriggerScheduler {
    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private static final int MAX_CONSECUTIVE_FAILURES = 30;
    private static final Duration STOP_GRACE = Duration.ofSeconds(30);

    private final TriggerStore store;
    private final FireEventChannel channel;
    private final Clock clock;
    private final Duration pollEvery;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);

    private volatile Thread pollerThread;
    private int systemErrorCount = 0;

    public TriggerScheduler(TriggerStore store, FireEventChannel channel, Clock clock, Duration pollEvery) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.pollEvery = Objects.requireNonNull(pollEvery, "pollEvery must not be null");
        if (pollEvery.isZero() || pollEvery.isNegative()) {
            throw new IllegalArgumentException("pollEvery must be a positive duration");
        }
    }

    /**
     * Start the poller thread. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        systemErrorCount = 0;
        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("notify.scheduler");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Trigger scheduler started with pollEvery={}", pollEvery);
    }

    /**
     * Stop the poller thread and wait for a poll in progress to hand off its claims.
     * Idempotent; does not wait for dispatches.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null) {
            poller.interrupt();
            try {
                poller.join(STOP_GRACE.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (poller.isAlive()) {
                log.warn("Trigger scheduler poller did not stop within {}", STOP_GRACE);
            }
        }
        wakeSignal.drainPermits();
        log.info("Trigger scheduler stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Ask the poller to check for due triggers now instead of waiting for the next period.
     */
    public void wake() {
        wakeSignal.release();
    }

    /**
     * Claim everything due at the current clock time and publish one fire event per trigger.
     * Nothing is claimed while the channel is not accepting events.
     *
     * @return number of fire events published
     */
    public int pollOnce() {
        if (!channel.isAccepting()) {
            log.debug("Scheduler skipped poll, fire event channel is not accepting events");
            return 0;
        }
        Instant now = clock.instant();
        List<ArmedTrigger> due = store.listDue(now);
        log.debug("Scheduler polled due triggers count={} now={}", due.size(), now);

        int published = 0;
        for (ArmedTrigger trigger : due) {
            FireEvent event = FireEvent.of(trigger, now);
            try {
                channel.publish(event);
                published++;
            } catch (RuntimeException e) {
                log.error("Fire event lost subjectId={} triggerKey={} msg={}",
                        trigger.subjectId(), trigger.triggerKey(), e.getMessage(), e);
            }
        }
        return published;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("Scheduler poll failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("Trigger scheduler stopped due to repeated store failures");
                    started.set(false);
                    break;
                }
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                wakeSignal.tryAcquire(pollEvery.toMillis(), TimeUnit.MILLISECONDS);
                wakeSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll failures: 1s, 2s, 4s ... capped at 60s.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
