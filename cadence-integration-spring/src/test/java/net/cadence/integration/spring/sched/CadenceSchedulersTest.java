package net.cadence.integration.spring.sched;

import net.cadence.core.exec.CommandRegistry;
import net.cadence.core.exec.JobExecutor;
import net.cadence.core.maintenance.LogRetentionService;
import net.cadence.core.maintenance.RetentionUnit;
import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.notify.NotificationDispatcher;
import net.cadence.core.notify.NotificationSettings;
import net.cadence.core.recurrence.RecurrenceEngine;
import net.cadence.core.service.JobRunner;
import net.cadence.core.service.JobTickService;
import net.cadence.core.service.RunRecorder;
import net.cadence.core.support.DirectTxRunner;
import net.cadence.core.support.FakeProcessSpawner;
import net.cadence.core.support.InMemoryJobRepository;
import net.cadence.core.support.InMemoryLogRepository;
import net.cadence.core.support.MutableClock;
import net.cadence.core.support.RecordingMailTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CadenceSchedulersTest {

    static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

    InMemoryJobRepository jobs;
    InMemoryLogRepository logs;
    CadenceSchedulers schedulers;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        DirectTxRunner tx = new DirectTxRunner();
        jobs = new InMemoryJobRepository();
        logs = new InMemoryLogRepository();
        CommandRegistry commands = new CommandRegistry().register("noop", inv -> { });

        JobRunner runner = new JobRunner(jobs, tx, clock,
                new JobExecutor(commands, new FakeProcessSpawner()),
                new RunRecorder(logs, tx),
                new RecurrenceEngine(),
                new NotificationDispatcher(new RecordingMailTransport(), new NotificationSettings("x@example.com", "", null)));
        schedulers = new CadenceSchedulers(
                new JobTickService(jobs, runner, tx, clock),
                new LogRetentionService(logs, tx, clock));
    }

    @Test
    void tick_runsDueJobs() throws Exception {
        Job job = jobs.save(Job.ofCommand("j", Frequency.DAILY, "", "noop", "").withSchedule(null, NOW.minusSeconds(1)));

        schedulers.tick();

        assertThat(logs.findByJob(job.id())).hasSize(1);
    }

    @Test
    void maintenance_purgesOnlyWhenEnabled() throws Exception {
        Instant old = NOW.minus(Duration.ofDays(3));
        logs.create(Log.ofRun(1L, old, old, new ExecutionResult(true, "", "")));

        schedulers.maintenance();
        assertThat(logs.all()).hasSize(1);

        schedulers.setRetentionEnabled(true);
        schedulers.setRetentionAmount(2);
        schedulers.setRetentionUnit(RetentionUnit.DAYS);
        schedulers.maintenance();
        assertThat(logs.all()).isEmpty();
    }
}
