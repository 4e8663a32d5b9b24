package io.notify4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.DispatchListener;
import io.notify4j.NotificationDispatcher;
import io.notify4j.NotificationScheduler;
import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.DailyTime;
import io.notify4j.core.DispatchFailure;
import io.notify4j.core.RescheduleResult;
import io.notify4j.core.SchedulerOptions;
import io.notify4j.core.TriggerSpec;
import io.notify4j.core.TriggerStore;
import io.notify4j.utils.ScheduleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link NotificationScheduler}: compiles schedules, keeps triggers in a
 * {@link TriggerStore}, fires them through a {@link TriggerScheduler} and dispatches them on a
 * {@link NotificationWorker}.
 *
 * <p>Arming and cancelling work whether or not the engine is started; triggers only fire
 * while it runs.
 */
public class DefaultNotificationScheduler implements NotificationScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultNotificationScheduler.class);

    private final SchedulerOptions options;
    private final TriggerStore store;
    private final NotificationWorker worker;
    private final TriggerScheduler scheduler;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultNotificationScheduler(SchedulerOptions options,
                                        TriggerStore store,
                                        NotificationDispatcher<?> dispatcher,
                                        DispatchListener listener,
                                        ObjectMapper objectMapper,
                                        Clock clock) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.worker = new NotificationWorker(
                dispatcher,
                listener,
                objectMapper,
                clock,
                options.workerConcurrency(),
                options.maxRetainedFailures()
        );
        this.scheduler = new TriggerScheduler(store, worker, clock, options.pollEvery());
    }

    /**
     * Start the worker, then the scheduler. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Notification scheduler starting with pollEvery={}, workerConcurrency={}, maxRetainedFailures={}, strictScheduleRange={}, zone={}",
                options.pollEvery(),
                options.workerConcurrency(),
                options.maxRetainedFailures(),
                options.strictScheduleRange(),
                clock.getZone());
        worker.start();
        scheduler.start();
        log.info("Notification scheduler started successfully.");
    }

    /**
     * Stop the scheduler, then drain the worker. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Notification scheduler stopping...");
        scheduler.stop();
        worker.stop();
        log.info("Notification scheduler stopped successfully.");
    }

    @Override
    public String arm(String subjectId, String schedule, Object payload) {
        DailyTime recurrence = ScheduleCompiler.compile(schedule, options.strictScheduleRange());
        TriggerSpec spec = TriggerSpec.of(subjectId, recurrence);

        String triggerKey = store.arm(spec.subjectId(), payload, spec.recurrence());
        log.info("Armed trigger subjectId={} schedule={} cron=\"{}\" triggerKey={}",
                subjectId, recurrence, recurrence.toCronExpression(), triggerKey);

        if (started.get()) {
            scheduler.wake();
        }
        return triggerKey;
    }

    @Override
    public String arm(String subjectId, String schedule) {
        return arm(subjectId, schedule, null);
    }

    @Override
    public RescheduleResult reschedule(String subjectId, String schedule, Object payload) {
        String triggerKey = arm(subjectId, schedule, payload);
        return RescheduleResult.updated(triggerKey, schedule);
    }

    @Override
    public boolean cancel(String triggerKey) {
        boolean cancelled = store.cancel(triggerKey);
        if (cancelled) {
            log.info("Cancelled trigger triggerKey={}", triggerKey);
        } else {
            log.debug("No scheduled trigger to cancel triggerKey={}", triggerKey);
        }
        return cancelled;
    }

    @Override
    public Optional<ArmedTrigger> find(String subjectId) {
        return store.get(subjectId);
    }

    @Override
    public List<DispatchFailure> failedDispatches() {
        return worker.failedDispatches();
    }

    /**
     * Run one due-check immediately on the calling thread (useful for tests and manual triggers).
     *
     * @return number of fire events handed to the worker, 0 while the engine is stopped
     */
    public int pollNow() {
        return scheduler.pollOnce();
    }

    @Override
    public boolean isRunning() {
        return started.get() && scheduler.isRunning();
    }
}
