package net.cadence.core.notify;

/** Mail transport failure. Not handled by the runner; surfaces to whoever called it. */
public class NotificationException extends RuntimeException {
    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
