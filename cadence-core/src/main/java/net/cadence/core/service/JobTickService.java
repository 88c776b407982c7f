package net.cadence.core.service;

import net.cadence.core.model.Job;
import net.cadence.core.notify.NotificationException;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/** One pass of the driver: run every job that is due, one after another. */
public final class JobTickService {
    private static final Logger log = LoggerFactory.getLogger(JobTickService.class);

    private final JobRepository jobs;
    private final JobRunner runner;
    private final TxRunner tx;
    private final Clock clock;

    public JobTickService(JobRepository jobs, JobRunner runner, TxRunner tx, Clock clock) {
        this.jobs = jobs;
        this.runner = runner;
        this.tx = tx;
        this.clock = clock;
    }

    /** @return number of jobs run */
    public int tickOnce() throws Exception {
        Instant now = clock.now();
        List<Job> due = tx.requiresNew(() -> jobs.findDue(now));
        if (due.isEmpty()) return 0;

        log.debug("{} job(s) due at {}", due.size(), now);
        int ran = 0;
        for (Job job : due) {
            try {
                runner.run(job);
            } catch (NotificationException e) {
                log.error("Job '{}' ran but its notification failed", job.name(), e);
            }
            ran++;
        }
        return ran;
    }
}
