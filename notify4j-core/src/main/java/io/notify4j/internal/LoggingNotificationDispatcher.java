package io.notify4j.internal;

import io.notify4j.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fallback dispatcher that only logs the notification. Used until an email sender is configured.
 *
 * <p>Accepts any payload. Map payloads are logged by their {@code title} and {@code body}
 * entries, anything else as-is.
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher<Object> {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public Class<Object> payloadClass() {
        return Object.class;
    }

    @Override
    public void dispatch(String subjectId, Object payload) {
        if (payload instanceof Map<?, ?> note) {
            log.info("Dispatching notification for note subjectId={} title=\"{}\" body={}",
                    subjectId, note.get("title"), note.get("body"));
        } else {
            log.info("Dispatching notification for note subjectId={} payload={}", subjectId, payload);
        }
    }
}
