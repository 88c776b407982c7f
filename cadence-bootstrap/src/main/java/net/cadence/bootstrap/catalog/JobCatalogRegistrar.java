package net.cadence.bootstrap.catalog;

import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Subscriber;
import net.cadence.core.service.JobScheduleService;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Upserts the jobs declared under {@code cadence.catalog.jobs}, matched by name.
 * <p>
 * Run state of an existing job (last run, running flag, outcome) is kept. Its next run is kept too,
 * unless the schedule itself changed or the job was re-enabled.
 */
public class JobCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogRegistrar.class);

    private final JobRepository jobs;
    private final JobScheduleService schedule;
    private final TxRunner tx;

    public JobCatalogRegistrar(JobRepository jobs, JobScheduleService schedule, TxRunner tx) {
        this.jobs = jobs;
        this.schedule = schedule;
        this.tx = tx;
    }

    /** @return number of jobs registered */
    public int register(CadenceProperties.Catalog catalog) throws Exception {
        // command mode and recurrence rule of every entry are checked before anything is saved
        List<Job> defined = catalog.getJobs().stream()
                .map(JobCatalogRegistrar::toJob)
                .map(schedule::validate)
                .toList();

        for (Job def : defined) {
            Job saved = tx.required(() -> upsert(def));
            log.info("Catalog registered: job='{}' id={} frequency={} nextRun={}",
                    saved.name(), saved.id(), saved.frequency(), saved.nextRun());
        }
        return defined.size();
    }

    private Job upsert(Job def) throws Exception {
        Optional<Job> existing = jobs.findByName(def.name());
        if (existing.isEmpty()) {
            return jobs.save(schedule.prepare(def));
        }

        Job cur = existing.get();
        boolean sameSchedule = cur.frequency() == def.frequency()
                && Objects.equals(nz(cur.params()), nz(def.params()))
                && !cur.disabled();
        Job merged = new Job(cur.id(), def.name(), def.frequency(), def.params(),
                def.command(), def.shellCommand(), def.runInShell(), def.args(),
                def.disabled(),
                sameSchedule ? cur.nextRun() : null,
                cur.lastRun(), cur.running(), cur.lastRunSuccessful(),
                def.infoSubscribers(), def.errorSubscribers());
        return jobs.save(schedule.prepare(merged));
    }

    static Job toJob(CadenceProperties.JobDef d) {
        return new Job(null, d.getName(), Frequency.from(d.getFrequency()), nz(d.getParams()),
                d.getCommand(), d.getShellCommand(), d.isRunInShell(), d.getArgs(),
                d.isDisabled(), null, null, false, true,
                subscribers(d.getInfoSubscribers()), subscribers(d.getErrorSubscribers()));
    }

    private static List<Subscriber> subscribers(List<CadenceProperties.SubscriberDef> defs) {
        if (defs == null) return List.of();
        return defs.stream()
                .map(s -> new Subscriber(s.getUsername() != null ? s.getUsername() : s.getEmail(), s.getFullName(), s.getEmail()))
                .toList();
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
