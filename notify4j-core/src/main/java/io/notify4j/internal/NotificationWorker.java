package io.notify4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.DispatchListener;
import io.notify4j.NotificationDispatcher;
import io.notify4j.core.DispatchFailure;
import io.notify4j.core.FireEvent;
import io.notify4j.core.FireEventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes fire events on a fixed thread pool and hands each to the
 * {@link NotificationDispatcher}.
 *
 * <p>Every event is processed once. Failed dispatches are reported and retained, never retried.
 */
public class NotificationWorker implements FireEventChannel {
    private static final Logger log = LoggerFactory.getLogger(NotificationWorker.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final NotificationDispatcher<?> dispatcher;
    private final DispatchListener listener;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int concurrency;
    private final int maxRetainedFailures;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Deque<DispatchFailure> failures = new ArrayDeque<>();

    private volatile ExecutorService workerPool;

    public NotificationWorker(NotificationDispatcher<?> dispatcher,
                              DispatchListener listener,
                              ObjectMapper objectMapper,
                              Clock clock,
                              int concurrency,
                              int maxRetainedFailures) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (maxRetainedFailures < 0) {
            throw new IllegalArgumentException("maxRetainedFailures must not be negative");
        }
        this.concurrency = concurrency;
        this.maxRetainedFailures = maxRetainedFailures;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger threadIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r);
            t.setName("notify.worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Notification worker started with concurrency={}", concurrency);
    }

    /**
     * Stop accepting events and wait for in-flight dispatches.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(SHUTDOWN_GRACE.toSeconds(), TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        } finally {
            workerPool = null;
        }
        log.info("Notification worker stopped.");
    }

    /**
     * Queue an event for dispatch and return immediately.
     *
     * @throws IllegalStateException if the worker is not running
     */
    @Override
    public void publish(FireEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        ExecutorService pool = workerPool;
        if (!started.get() || pool == null) {
            throw new IllegalStateException("Notification worker is not running");
        }
        try {
            pool.execute(() -> process(event));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Notification worker rejected event for subject " + event.subjectId(), e);
        }
    }

    @Override
    public boolean isAccepting() {
        return started.get() && workerPool != null;
    }

    /**
     * Dispatch one event on the calling thread.
     *
     * @return true when the dispatcher completed without error
     */
    boolean process(FireEvent event) {
        log.info("Processing fire event triggerKey={} subjectId={} scheduledFor={}",
                event.triggerKey(), event.subjectId(), event.scheduledFor());
        notifyListener(() -> listener.onPickup(event));

        Instant startedAt = clock.instant();
        try {
            executeDispatch(event);
        } catch (Exception e) {
            DispatchFailure failure = DispatchFailure.of(event, clock.instant(), e);
            log.error("Notification dispatch failed subjectId={} triggerKey={} msg={}",
                    event.subjectId(), event.triggerKey(), e.getMessage(), e);
            retain(failure);
            notifyListener(() -> listener.onFailure(failure, e));
            return false;
        }

        Duration took = Duration.between(startedAt, clock.instant());
        log.debug("Notification delivered subjectId={} triggerKey={} took={}",
                event.subjectId(), event.triggerKey(), took);
        notifyListener(() -> listener.onDelivered(event, took));
        return true;
    }

    @SuppressWarnings("unchecked")
    private <T> void executeDispatch(FireEvent event) throws Exception {
        var d = (NotificationDispatcher<T>) dispatcher;
        Object raw = event.payload();
        T payload = (raw == null) ? null : objectMapper.convertValue(raw, d.payloadClass());
        d.dispatch(event.subjectId(), payload);
    }

    private void retain(DispatchFailure failure) {
        if (maxRetainedFailures == 0) {
            return;
        }
        synchronized (failures) {
            failures.addLast(failure);
            while (failures.size() > maxRetainedFailures) {
                failures.removeFirst();
            }
        }
    }

    public List<DispatchFailure> failedDispatches() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    private static void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("DispatchListener callback failed msg={}", e.getMessage(), e);
        }
    }
}
