package net.cadence.core.notify;

/**
 * @param from            sender address
 * @param subjectPrefix   prepended to every subject, e.g. {@code "[cadence] "}
 * @param logUrlPattern   link to a log entry; {@code {id}} is replaced with the log id
 */
public record NotificationSettings(String from, String subjectPrefix, String logUrlPattern) {
    public NotificationSettings {
        subjectPrefix = subjectPrefix == null ? "" : subjectPrefix;
        logUrlPattern = logUrlPattern == null ? "log #{id}" : logUrlPattern;
    }

    public String logUrl(long logId) {
        return logUrlPattern.replace("{id}", Long.toString(logId));
    }
}
