package net.cadence.bootstrap.autoconfigure;

import net.cadence.bootstrap.catalog.JobCatalogRegistrar;
import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.exec.CommandRegistry;
import net.cadence.core.exec.JobExecutor;
import net.cadence.core.exec.LocalProcessSpawner;
import net.cadence.core.exec.ManagedCommand;
import net.cadence.core.maintenance.LogRetentionService;
import net.cadence.core.notify.NotificationDispatcher;
import net.cadence.core.notify.NotificationSettings;
import net.cadence.core.recurrence.RecurrenceEngine;
import net.cadence.core.service.JobAdminService;
import net.cadence.core.service.JobRunner;
import net.cadence.core.service.JobScheduleService;
import net.cadence.core.service.JobTickService;
import net.cadence.core.service.RunRecorder;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.LogRepository;
import net.cadence.core.spi.MailTransport;
import net.cadence.core.spi.ProcessSpawner;
import net.cadence.core.spi.RecurrenceCalculator;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.CadenceSpringConfig;
import net.cadence.integration.spring.mail.LoggingMailTransport;
import net.cadence.integration.spring.mail.SpringMailTransport;
import net.cadence.integration.spring.sched.CadenceSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.MailSender;

import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration")
@EnableConfigurationProperties(CadenceProperties.class)
@Import(CadenceSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class CadenceAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CadenceAutoConfiguration.class);

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean(RecurrenceCalculator.class)
    public RecurrenceEngine recurrenceEngine(CadenceProperties props) {
        return new RecurrenceEngine(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean(ProcessSpawner.class)
    public ProcessSpawner processSpawner() {
        return new LocalProcessSpawner();
    }

    /** Every {@link ManagedCommand} bean, under its bean name. */
    @Bean
    @ConditionalOnMissingBean
    public CommandRegistry commandRegistry(ListableBeanFactory beans) {
        var registry = new CommandRegistry(beans.getBeansOfType(ManagedCommand.class));
        log.info("Managed commands: {}", registry.names().stream().sorted().collect(Collectors.joining(", ")));
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(MailTransport.class)
    @ConditionalOnBean(MailSender.class)
    public MailTransport springMailTransport(MailSender sender) {
        return new SpringMailTransport(sender);
    }

    @Bean
    @ConditionalOnMissingBean(MailTransport.class)
    public MailTransport loggingMailTransport() {
        return new LoggingMailTransport();
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(CommandRegistry commands, ProcessSpawner processes) {
        return new JobExecutor(commands, processes);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(MailTransport transport, CadenceProperties props) {
        var n = props.getNotification();
        return new NotificationDispatcher(transport,
                new NotificationSettings(n.getFrom(), n.getSubjectPrefix(), n.getLogUrlPattern()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RunRecorder runRecorder(LogRepository logs, TxRunner tx) {
        return new RunRecorder(logs, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(JobRepository jobs,
                               TxRunner tx,
                               Clock clock,
                               JobExecutor executor,
                               RunRecorder recorder,
                               RecurrenceCalculator recurrence,
                               NotificationDispatcher notifier) {
        return new JobRunner(jobs, tx, clock, executor, recorder, recurrence, notifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobTickService jobTick(JobRepository jobs, JobRunner runner, TxRunner tx, Clock clock) {
        return new JobTickService(jobs, runner, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduleService jobSchedule(JobRepository jobs, TxRunner tx, Clock clock, RecurrenceCalculator recurrence) {
        return new JobScheduleService(jobs, tx, clock, recurrence);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdminService jobAdmin(JobRepository jobs, LogRepository logs, JobRunner runner, TxRunner tx, Clock clock) {
        return new JobAdminService(jobs, logs, runner, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LogRetentionService logRetention(LogRepository logs, TxRunner tx, Clock clock) {
        return new LogRetentionService(logs, tx, clock);
    }

    // --- scheduler (delays come from cadence.scheduler.*-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "cadence.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CadenceSchedulers cadenceSchedulers(JobTickService tick,
                                               LogRetentionService retention,
                                               CadenceProperties props) {
        var s = new CadenceSchedulers(tick, retention);
        s.setRetentionEnabled(props.getRetention().isEnabled());
        s.setRetentionAmount(props.getRetention().getAmount());
        s.setRetentionUnit(props.getRetention().getUnit());
        return s;
    }

    // --- catalog ---

    @Bean
    @ConditionalOnMissingBean
    public JobCatalogRegistrar jobCatalogRegistrar(JobRepository jobs, JobScheduleService schedule, TxRunner tx) {
        return new JobCatalogRegistrar(jobs, schedule, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cadence.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(JobCatalogRegistrar registrar, CadenceProperties props) {
        return args -> {
            log.debug("Catalog:\n{}", props.getCatalog().getJobs().stream()
                    .map(CadenceProperties.JobDef::toString)
                    .collect(Collectors.joining("\n")));
            registrar.register(props.getCatalog());
        };
    }
}
