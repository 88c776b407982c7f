package net.cadence.core.recurrence;

public class RecurrenceParseException extends RuntimeException {
    public RecurrenceParseException(String message) {
        super(message);
    }

    public RecurrenceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
