package net.cadence.app.command;

import net.cadence.core.exec.ManagedCommand;
import net.cadence.core.maintenance.CleanLogsCommand;
import net.cadence.core.maintenance.LogRetentionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Management commands jobs can run by name; the bean name is the command name. */
@Configuration
public class BuiltinCommands {

    @Bean(CleanLogsCommand.NAME)
    public ManagedCommand cleanlogs(LogRetentionService retention) {
        return new CleanLogsCommand(retention);
    }
}
