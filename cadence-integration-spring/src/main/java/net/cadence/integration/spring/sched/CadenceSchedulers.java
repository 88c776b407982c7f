package net.cadence.integration.spring.sched;

import net.cadence.core.maintenance.LogRetentionService;
import net.cadence.core.maintenance.RetentionUnit;
import net.cadence.core.service.JobTickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class CadenceSchedulers {
    private static final Logger log = LoggerFactory.getLogger(CadenceSchedulers.class);

    private final JobTickService tick;
    private final LogRetentionService retention;

    private boolean retentionEnabled = false;
    private int retentionAmount = 4;
    private RetentionUnit retentionUnit = RetentionUnit.WEEKS;

    public CadenceSchedulers(JobTickService tick, LogRetentionService retention) {
        this.tick = tick;
        this.retention = retention;
    }

    @Scheduled(fixedDelayString = "${cadence.scheduler.tick-delay-ms:3000}")
    public void tick() throws Exception {
        int ran = tick.tickOnce();
        if (ran > 0) log.debug("Tick ran {} job(s)", ran);
    }

    @Scheduled(fixedDelayString = "${cadence.scheduler.maintenance-delay-ms:3600000}")
    public void maintenance() throws Exception {
        if (!retentionEnabled) return;
        retention.purge(retentionAmount, retentionUnit);
    }

    public void setRetentionEnabled(boolean retentionEnabled) {
        this.retentionEnabled = retentionEnabled;
    }

    public void setRetentionAmount(int retentionAmount) {
        this.retentionAmount = retentionAmount;
    }

    public void setRetentionUnit(RetentionUnit retentionUnit) {
        this.retentionUnit = retentionUnit;
    }
}
