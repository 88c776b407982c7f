package net.cadence.core.notify;

import net.cadence.core.model.Log;

/** Everything the subject and body are rendered from. */
public record NotificationContext(
        Log log,
        String jobName,
        String infoOutput,
        String errorOutput,
        String subjectPrefix
) {}
