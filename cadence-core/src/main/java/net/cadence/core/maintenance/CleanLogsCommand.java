package net.cadence.core.maintenance;

import net.cadence.core.exec.CommandInvocation;
import net.cadence.core.exec.ManagedCommand;

import java.util.List;

/**
 * {@code cleanlogs <unit> <amount>}: deletes logs older than the given age, e.g.
 * {@code cleanlogs weeks 4}.
 */
public final class CleanLogsCommand implements ManagedCommand {
    public static final String NAME = "cleanlogs";

    private final LogRetentionService retention;

    public CleanLogsCommand(LogRetentionService retention) {
        this.retention = retention;
    }

    @Override
    public void execute(CommandInvocation invocation) throws Exception {
        List<String> args = invocation.args();
        if (args.size() != 2) {
            throw new IllegalArgumentException(
                    "usage: " + NAME + " <unit> <amount> (unit: " + RetentionUnit.choices() + ")");
        }
        RetentionUnit unit = RetentionUnit.from(args.get(0));
        int amount;
        try {
            amount = Integer.parseInt(args.get(1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("amount must be an integer: '" + args.get(1) + "'", e);
        }

        LogRetentionService.PurgeReport report = retention.purge(amount, unit);
        invocation.out().println("Deleted " + report.deleted + " log(s) run on or before " + report.threshold);
    }
}
