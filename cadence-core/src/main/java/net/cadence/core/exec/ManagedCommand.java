package net.cadence.core.exec;

/** An in-process command a job can run by name. */
@FunctionalInterface
public interface ManagedCommand {
    void execute(CommandInvocation invocation) throws Exception;
}
