package net.cadence.core.service;

import net.cadence.core.exec.JobExecutor;
import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.notify.NotificationDispatcher;
import net.cadence.core.notify.NotificationException;
import net.cadence.core.recurrence.RecurrenceParams;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.RecurrenceCalculator;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Runs one job end to end: flag it running, execute, reload, store the outcome, advance the
 * schedule, write the log, notify subscribers.
 * <p>
 * The running flag is the only guard against a second driver picking the same job, and it is not
 * atomic with {@link JobRepository#findDue}. Between the reload and the final save another writer's
 * change to the same job is overwritten (last writer wins). Each store step runs in its own
 * transaction; the command itself runs outside any transaction.
 */
public final class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final JobExecutor executor;
    private final RunRecorder recorder;
    private final RecurrenceCalculator recurrence;
    private final NotificationDispatcher notifier;

    public JobRunner(JobRepository jobs,
                     TxRunner tx,
                     Clock clock,
                     JobExecutor executor,
                     RunRecorder recorder,
                     RecurrenceCalculator recurrence,
                     NotificationDispatcher notifier) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.executor = executor;
        this.recorder = recorder;
        this.recurrence = recurrence;
        this.notifier = notifier;
    }

    public Log run(Job job) {
        return run(job, true);
    }

    /**
     * @param save when false (preview runs) last/next run are left untouched
     * @return the log written for this run
     * @throws NotificationException only when mailing the outcome fails; command failures never escape
     */
    public Log run(Job job, boolean save) {
        Job current = persist(job.withRunning(true), "flag running");
        Instant runStart = clock.now();
        log.info("Running job '{}' (id={})", current.name(), current.id());

        ExecutionResult result = executor.execute(current);

        // the command may have run for a long time; pick up edits made meanwhile
        Job finished = persist(reload(current).withOutcome(result.success()), "store outcome");

        if (save) {
            Instant next = null;
            if (!finished.disabled()) {
                try {
                    next = recurrence.next(finished.frequency(), RecurrenceParams.parse(finished.params()), runStart)
                            .orElse(null);
                } catch (RuntimeException e) {
                    log.error("Could not compute next run of job '{}' from params '{}'", finished.name(), finished.params(), e);
                    result = result.appendStderr("\n\n*** Could not compute next run: " + e.getMessage() + "\n\n");
                }
            }
            finished = persist(finished.withSchedule(runStart, next), "advance schedule");
            log.debug("Job '{}' next run at {}", finished.name(), next);
        }

        Log entry = recorder.record(finished, runStart, clock.now(), result);
        log.info("Job '{}' finished: success={} duration={}",
                finished.name(), entry.success(), RunRecorder.duration(entry).orElse(null));

        notifier.dispatch(entry, finished);
        return entry;
    }

    private Job reload(Job job) {
        if (job.id() == null) return job;
        try {
            return tx.required(() -> jobs.findById(job.id())).orElseGet(() -> {
                log.warn("Job '{}' (id={}) disappeared while running", job.name(), job.id());
                return job;
            });
        } catch (Exception e) {
            log.error("Could not reload job '{}' (id={})", job.name(), job.id(), e);
            return job;
        }
    }

    private Job persist(Job job, String step) {
        try {
            return tx.required(() -> jobs.save(job));
        } catch (Exception e) {
            log.error("Could not {} for job '{}' (id={})", step, job.name(), job.id(), e);
            return job;
        }
    }
}
