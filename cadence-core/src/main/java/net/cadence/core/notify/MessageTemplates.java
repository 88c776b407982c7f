package net.cadence.core.notify;

import java.time.format.DateTimeFormatter;

/** Plain-text subject and body for run notifications. */
public final class MessageTemplates {
    private static final DateTimeFormatter TS = DateTimeFormatter.ISO_INSTANT;

    private MessageTemplates() {}

    public static String subject(NotificationContext ctx) {
        String outcome = ctx.log().success() ? "Output" : "Error";
        return ctx.subjectPrefix() + outcome + " from job \"" + ctx.jobName() + "\"";
    }

    public static String body(NotificationContext ctx) {
        var log = ctx.log();
        StringBuilder sb = new StringBuilder();
        sb.append("Job: ").append(ctx.jobName()).append('\n');
        sb.append("Run date: ").append(TS.format(log.runDate())).append('\n');
        if (log.endDate() != null) sb.append("End date: ").append(TS.format(log.endDate())).append('\n');
        sb.append("Status: ").append(log.success() ? "succeeded" : "FAILED").append('\n');

        if (!ctx.infoOutput().isEmpty()) {
            sb.append('\n').append(log.success() ? "Output:" : "Details:").append('\n');
            sb.append(ctx.infoOutput()).append('\n');
        }
        if (!ctx.errorOutput().isEmpty()) {
            sb.append('\n').append("Errors:").append('\n');
            sb.append(ctx.errorOutput()).append('\n');
        }
        return sb.toString();
    }
}
