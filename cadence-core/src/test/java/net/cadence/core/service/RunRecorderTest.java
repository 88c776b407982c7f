package net.cadence.core.service;

import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.support.DirectTxRunner;
import net.cadence.core.support.InMemoryLogRepository;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RunRecorderTest {

    static final Instant START = Instant.parse("2024-01-10T06:40:00Z");

    @Test
    void recordsEveryRun_evenWithoutOutput() {
        InMemoryLogRepository logs = new InMemoryLogRepository();
        RunRecorder recorder = new RunRecorder(logs, new DirectTxRunner());
        Job job = Job.ofCommand("j", Frequency.DAILY, "", "noop", "").withId(3);

        Log entry = recorder.record(job, START, START.plusMillis(1500), new ExecutionResult(true, null, null));

        assertThat(entry.id()).isNotNull();
        assertThat(entry.jobId()).isEqualTo(3L);
        assertThat(entry.stdout()).isEmpty();
        assertThat(entry.stderr()).isEmpty();
        assertThat(logs.all()).containsExactly(entry);
        assertThat(RunRecorder.duration(entry)).contains(Duration.ofMillis(1500));
    }

    @Test
    void durationUnknownWithoutEndDate() {
        Log open = new Log(1L, 1L, START, null, "", "", true);
        assertThat(RunRecorder.duration(open)).isEmpty();
    }
}
