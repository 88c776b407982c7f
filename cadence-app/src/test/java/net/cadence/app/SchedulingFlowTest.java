package net.cadence.app;

import net.cadence.core.exec.ManagedCommand;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.service.JobAdminService;
import net.cadence.core.service.JobScheduleService;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowTest {

    @Container
    static OracleContainer oracle = new OracleContainer("gvenzl/oracle-xe:21-slim")
            .withStartupTimeout(Duration.ofMinutes(5));

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", oracle::getJdbcUrl);
        r.add("spring.datasource.username", oracle::getUsername);
        r.add("spring.datasource.password", oracle::getPassword);
        r.add("cadence.scheduler.tick-delay-ms", () -> "300");
        r.add("cadence.retention.enabled", () -> "false");
        r.add("cadence.catalog.jobs[0].name", () -> "catalog-echo");
        r.add("cadence.catalog.jobs[0].frequency", () -> "HOURLY");
        r.add("cadence.catalog.jobs[0].command", () -> "greet");
        r.add("cadence.catalog.jobs[0].args", () -> "catalog");
    }

    @TestConfiguration
    static class Commands {
        @Bean
        ManagedCommand greet() {
            return inv -> inv.out().print("hello " + String.join(" ", inv.args()));
        }
    }

    @Autowired JdbcTemplate jdbc;
    @Autowired TxRunner tx;
    @Autowired JobRepository jobs;
    @Autowired JobScheduleService schedule;
    @Autowired JobAdminService admin;

    @Test
    void catalogJobIsRegistered() throws Exception {
        Job job = tx.required(() -> jobs.findByName("catalog-echo")).orElseThrow();

        assertThat(job.frequency()).isEqualTo(Frequency.HOURLY);
        assertThat(job.nextRun()).isAfter(Instant.now().minusSeconds(5));
    }

    @Test
    void dueJobIsRunByTheScheduler() throws Exception {
        Job job = schedule.register(Job.ofCommand("flow", Frequency.MINUTELY, "", "greet", "from flow")
                .withSchedule(null, Instant.now().minusSeconds(1)));

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            List<Log> logs = admin.logs(job.id());
            assertThat(logs).isNotEmpty();
            assertThat(logs.get(0).stdout()).isEqualTo("hello from flow");
            assertThat(logs.get(0).success()).isTrue();
        });

        Job after = tx.required(() -> jobs.findById(job.id())).orElseThrow();
        assertThat(after.running()).isFalse();
        assertThat(after.nextRun()).isAfter(Instant.now());
    }

    @Test
    void cleanlogsCommandRunsAsAJob() throws Exception {
        Job target = schedule.register(Job.ofCommand("old-logs", Frequency.DAILY, "", "greet", "")
                .withSchedule(null, Instant.now().plusSeconds(3600)));
        jdbc.update("""
                INSERT INTO TB_JOB_LOG(JOB_ID, RUN_DATE, END_DATE, SUCCESS)
                VALUES (?, SYSTIMESTAMP - NUMTODSINTERVAL(60, 'DAY'), SYSTIMESTAMP - NUMTODSINTERVAL(60, 'DAY'), 'Y')
                """, target.id());

        Job cleaner = schedule.register(Job.ofCommand("cleaner", Frequency.DAILY, "", "cleanlogs", "weeks 4")
                .withSchedule(null, Instant.now().plusSeconds(3600)));
        Log run = admin.runNow(cleaner.id());

        assertThat(run.success()).isTrue();
        assertThat(run.stdout()).startsWith("Deleted 1 log(s)");
        assertThat(admin.logs(target.id())).isEmpty();
    }
}
