package net.cadence.core.service;

import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.LogRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/** Operator actions on jobs and their logs. */
public final class JobAdminService {
    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    private final JobRepository jobs;
    private final LogRepository logs;
    private final JobRunner runner;
    private final TxRunner tx;
    private final Clock clock;

    public JobAdminService(JobRepository jobs, LogRepository logs, JobRunner runner, TxRunner tx, Clock clock) {
        this.jobs = jobs;
        this.logs = logs;
        this.runner = runner;
        this.tx = tx;
        this.clock = clock;
    }

    /** Runs the job right away, due or not, and advances its schedule. */
    public Log runNow(long jobId) throws Exception {
        Job job = tx.required(() -> jobs.findById(jobId))
                .orElseThrow(() -> new NoSuchElementException("No job with id " + jobId));
        return runner.run(job);
    }

    public int disable(Collection<Long> jobIds) throws Exception {
        int n = tx.required(() -> jobs.disable(jobIds));
        log.info("Disabled {} job(s): {}", n, jobIds);
        return n;
    }

    /** Clears a running flag left behind by a run that never finished. */
    public int resetRunning(Collection<Long> jobIds) throws Exception {
        int n = tx.required(() -> jobs.resetRunning(jobIds));
        log.info("Reset running flag of {} job(s): {}", n, jobIds);
        return n;
    }

    public List<Log> logs(long jobId) throws Exception {
        return tx.required(() -> logs.findByJob(jobId));
    }

    public Optional<Log> latestLog(long jobId) throws Exception {
        return tx.required(() -> logs.findLatest(jobId));
    }

    public String timeUntil(Job job) {
        return timeUntil(job, clock.now());
    }

    public String timeUntil(Job job, Instant now) {
        return TimeUntil.describe(job, now);
    }
}
