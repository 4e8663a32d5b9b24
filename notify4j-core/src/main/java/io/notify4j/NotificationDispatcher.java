package io.notify4j;


/**
 * Performs the notification side effect (e.g. sending an email) for a fired trigger.
 */
public interface NotificationDispatcher<T> {

    /**
     * Type the stored payload is converted to before {@link #dispatch(String, Object)}.
     */
    Class<T> payloadClass();

    void dispatch(String subjectId, T payload) throws Exception;
}
