package net.cadence.core.model;

import java.time.Instant;

public record Log(
        Long id,
        Long jobId,
        Instant runDate,
        Instant endDate,    // null until the run has completed
        String stdout,
        String stderr,
        boolean success
) {
    public Log {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static Log ofRun(Long jobId, Instant runDate, Instant endDate, ExecutionResult result) {
        return new Log(null, jobId, runDate, endDate, result.stdout(), result.stderr(), result.success());
    }

    public Log withId(long id) {
        return new Log(id, jobId, runDate, endDate, stdout, stderr, success);
    }
}
