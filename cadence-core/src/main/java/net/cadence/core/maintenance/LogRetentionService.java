package net.cadence.core.maintenance;

import net.cadence.core.spi.Clock;
import net.cadence.core.spi.LogRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public final class LogRetentionService {
    private static final Logger log = LoggerFactory.getLogger(LogRetentionService.class);

    private final LogRepository logs;
    private final TxRunner tx;
    private final Clock clock;

    public LogRetentionService(LogRepository logs, TxRunner tx, Clock clock) {
        this.logs = logs;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Deletes every log whose run date is on or before {@code now - amount * unit}.
     */
    public PurgeReport purge(int amount, RetentionUnit unit) throws Exception {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0: " + amount);
        if (unit == null) throw new IllegalArgumentException("unit is required");

        Instant now = clock.now();
        Instant threshold = now.minus(unit.times(amount));

        PurgeReport r = new PurgeReport();
        r.timestamp = now;
        r.threshold = threshold;
        r.deleted = tx.required(() -> logs.deleteRunOnOrBefore(threshold));

        log.info("Log retention: {}", r);
        return r;
    }

    public static final class PurgeReport {
        public Instant timestamp;
        public Instant threshold;
        public int deleted;

        @Override public String toString() {
            return "PurgeReport{" +
                    "timestamp=" + timestamp +
                    ", threshold=" + threshold +
                    ", deleted=" + deleted +
                    '}';
        }
    }
}
