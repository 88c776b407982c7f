package net.cadence.core.notify;

import java.util.List;

public record Notification(Kind kind, List<String> recipients, String subject, String body) {
    public enum Kind { INFO, ERROR }

    public Notification {
        recipients = List.copyOf(recipients);
    }
}
