package net.cadence.core.service;

import net.cadence.core.exec.CommandRegistry;
import net.cadence.core.exec.JobExecutor;
import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.notify.NotificationDispatcher;
import net.cadence.core.notify.NotificationSettings;
import net.cadence.core.recurrence.RecurrenceEngine;
import net.cadence.core.support.DirectTxRunner;
import net.cadence.core.support.FakeProcessSpawner;
import net.cadence.core.support.InMemoryJobRepository;
import net.cadence.core.support.InMemoryLogRepository;
import net.cadence.core.support.MutableClock;
import net.cadence.core.support.RecordingMailTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobAdminServiceTest {

    static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

    MutableClock clock;
    InMemoryJobRepository jobs;
    InMemoryLogRepository logs;
    CommandRegistry commands;
    JobAdminService admin;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        DirectTxRunner tx = new DirectTxRunner();
        jobs = new InMemoryJobRepository();
        logs = new InMemoryLogRepository();
        commands = new CommandRegistry();
        JobRunner runner = new JobRunner(jobs, tx, clock,
                new JobExecutor(commands, new FakeProcessSpawner()),
                new RunRecorder(logs, tx),
                new RecurrenceEngine(),
                new NotificationDispatcher(new RecordingMailTransport(), new NotificationSettings("x@example.com", "", null)));
        admin = new JobAdminService(jobs, logs, runner, tx, clock);
    }

    @Test
    void runNow_runsJobThatIsNotDue() throws Exception {
        commands.register("hello", inv -> inv.out().print("hello"));
        Job job = jobs.save(Job.ofCommand("j", Frequency.DAILY, "", "hello", "").withSchedule(null, NOW.plusSeconds(3600)));

        Log entry = admin.runNow(job.id());

        assertThat(entry.stdout()).isEqualTo("hello");
        assertThat(jobs.findById(job.id()).orElseThrow().lastRun()).isEqualTo(NOW);
    }

    @Test
    void runNow_unknownJob() {
        assertThatThrownBy(() -> admin.runNow(99)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void disableAndReset() throws Exception {
        Job a = jobs.save(Job.ofCommand("a", Frequency.DAILY, "", "noop", "").withSchedule(null, NOW).withRunning(true));
        Job b = jobs.save(Job.ofCommand("b", Frequency.DAILY, "", "noop", "").withSchedule(null, NOW));

        assertThat(admin.resetRunning(List.of(a.id()))).isEqualTo(1);
        assertThat(jobs.findById(a.id()).orElseThrow().running()).isFalse();

        assertThat(admin.disable(List.of(a.id(), b.id()))).isEqualTo(2);
        assertThat(jobs.findAll()).allSatisfy(j -> {
            assertThat(j.disabled()).isTrue();
            assertThat(j.nextRun()).isNull();
        });
        assertThat(admin.timeUntil(jobs.findById(b.id()).orElseThrow())).isEqualTo("never (disabled)");
    }

    @Test
    void logsNewestFirst() throws Exception {
        logs.create(Log.ofRun(1L, NOW.minusSeconds(7200), NOW.minusSeconds(7190), new ExecutionResult(true, "old", "")));
        logs.create(Log.ofRun(1L, NOW.minusSeconds(60), NOW.minusSeconds(50), new ExecutionResult(false, "", "new")));
        logs.create(Log.ofRun(2L, NOW, NOW, new ExecutionResult(true, "other job", "")));

        assertThat(admin.logs(1L)).extracting(Log::stdout).containsExactly("", "old");
        assertThat(admin.latestLog(1L)).hasValueSatisfying(l -> assertThat(l.stderr()).isEqualTo("new"));
        assertThat(admin.latestLog(3L)).isEmpty();
    }
}
