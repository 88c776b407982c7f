package net.cadence.core.service;

import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinitions;
import net.cadence.core.recurrence.RecurrenceParams;
import net.cadence.core.recurrence.RecurrenceParseException;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.RecurrenceCalculator;
import net.cadence.core.spi.TxRunner;

import java.time.Instant;

/** Entry point for creating or editing jobs outside a run. */
public final class JobScheduleService {
    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final RecurrenceCalculator recurrence;

    public JobScheduleService(JobRepository jobs, TxRunner tx, Clock clock, RecurrenceCalculator recurrence) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.recurrence = recurrence;
    }

    /**
     * Disabled jobs lose their next run. Otherwise a missing last run defaults to now and a missing
     * next run is the first occurrence after the last run.
     */
    public Job prepare(Job job) {
        if (job.disabled()) return job.withDisabled(true);

        Instant last = job.lastRun() != null ? job.lastRun() : clock.now();
        Instant next = job.nextRun();
        if (next == null) {
            next = recurrence.next(job.frequency(), RecurrenceParams.parse(job.params()), last).orElse(null);
        }
        return job.withSchedule(last, next);
    }

    /**
     * Checks the command mode and that the recurrence rule can be evaluated: non-integer values,
     * unknown keys and out-of-range values raise {@link RecurrenceParseException}.
     */
    public Job validate(Job job) {
        JobDefinitions.validate(job);
        recurrence.next(job.frequency(), RecurrenceParams.parse(job.params()), clock.now());
        return job;
    }

    /** Validates, fills in the schedule and saves. */
    public Job register(Job job) throws Exception {
        Job prepared = prepare(validate(job));
        return tx.required(() -> jobs.save(prepared));
    }
}
