package io.notify4j.internal;

import io.notify4j.DispatchListener;
import io.notify4j.core.DispatchFailure;
import io.notify4j.core.FireEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Default {@link DispatchListener}: reports delivery outcomes to the log.
 */
public class LoggingDispatchListener implements DispatchListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingDispatchListener.class);

    @Override
    public void onDelivered(FireEvent event, Duration took) {
        log.info("Notification delivered subjectId={} triggerKey={} took={}ms",
                event.subjectId(), event.triggerKey(), took.toMillis());
    }

    @Override
    public void onFailure(DispatchFailure failure, Throwable error) {
        log.warn("Notification not delivered, retained without retry subjectId={} triggerKey={} error={}",
                failure.event().subjectId(), failure.event().triggerKey(), failure.errorType());
    }
}
