package net.cadence.core.service;

import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.spi.LogRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Writes exactly one {@link Log} per run, whether or not the command produced output. */
public final class RunRecorder {
    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    private final LogRepository logs;
    private final TxRunner tx;

    public RunRecorder(LogRepository logs, TxRunner tx) {
        this.logs = logs;
        this.tx = tx;
    }

    /** Returns the stored entry, or the unsaved one (id = null) if the store rejected it. */
    public Log record(Job job, Instant runStart, Instant runEnd, ExecutionResult result) {
        Log entry = Log.ofRun(job.id(), runStart, runEnd, result);
        try {
            return tx.required(() -> logs.create(entry));
        } catch (Exception e) {
            log.error("Could not store run log of job '{}' (id={})", job.name(), job.id(), e);
            return entry;
        }
    }

    /** end − start; empty while the run has no end date. */
    public static Optional<Duration> duration(Log entry) {
        if (entry.endDate() == null) return Optional.empty();
        return Optional.of(Duration.between(entry.runDate(), entry.endDate()));
    }
}
