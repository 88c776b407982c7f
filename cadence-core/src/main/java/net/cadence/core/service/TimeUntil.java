package net.cadence.core.service;

import net.cadence.core.model.Job;

import java.time.Duration;
import java.time.Instant;

/** Human text for the time left until a job's next run, e.g. {@code 1 day, 3 hours}. */
public final class TimeUntil {
    private static final long[] CHUNK_SECONDS = {
            365L * 24 * 3600, 30L * 24 * 3600, 7L * 24 * 3600, 24L * 3600, 3600L, 60L
    };
    private static final String[] CHUNK_NAMES = {"year", "month", "week", "day", "hour", "minute"};

    private TimeUntil() {}

    public static String describe(Job job, Instant now) {
        if (job.disabled()) return "never (disabled)";
        if (job.nextRun() == null) return "never";

        long seconds = Duration.between(now, job.nextRun()).getSeconds();
        if (seconds < 0) return "due";
        if (seconds < 60) return plural(seconds, "second");

        for (int i = 0; i < CHUNK_SECONDS.length; i++) {
            long count = seconds / CHUNK_SECONDS[i];
            if (count == 0) continue;
            String text = plural(count, CHUNK_NAMES[i]);
            if (i + 1 < CHUNK_SECONDS.length) {
                long rest = (seconds - count * CHUNK_SECONDS[i]) / CHUNK_SECONDS[i + 1];
                if (rest > 0) text += ", " + plural(rest, CHUNK_NAMES[i + 1]);
            }
            return text;
        }
        return plural(seconds, "second");
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }
}
