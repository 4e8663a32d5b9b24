package io.notify4j.config;

import io.notify4j.NotificationScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle. Running state is read from
 * the scheduler itself.
 */
public class NotifyLifecycle implements SmartLifecycle {
    private final NotificationScheduler scheduler;

    public NotifyLifecycle(NotificationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
