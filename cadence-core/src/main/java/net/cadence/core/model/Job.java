package net.cadence.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A recurring task definition.
 * <p>
 * Exactly one of {@code command} (in-process) or {@code shellCommand} is expected to be set; see
 * {@link JobDefinitions#validate(Job)}. {@code params} holds the raw recurrence parameter string,
 * e.g. {@code byhour:6;byminute:40}.
 */
public record Job(
        Long id,
        String name,
        Frequency frequency,
        String params,
        String command,
        String shellCommand,
        boolean runInShell,
        String args,
        boolean disabled,
        Instant nextRun,
        Instant lastRun,
        boolean running,
        boolean lastRunSuccessful,
        List<Subscriber> infoSubscribers,
        List<Subscriber> errorSubscribers
) {
    public Job {
        frequency = frequency == null ? Frequency.DAILY : frequency;
        args = args == null ? "" : args;
        infoSubscribers = infoSubscribers == null ? List.of() : List.copyOf(infoSubscribers);
        errorSubscribers = errorSubscribers == null ? List.of() : List.copyOf(errorSubscribers);
    }

    public static Job ofCommand(String name, Frequency frequency, String params, String command, String args) {
        return new Job(null, name, frequency, params, command, null, false, args,
                false, null, null, false, true, List.of(), List.of());
    }

    public static Job ofShell(String name, Frequency frequency, String params,
                              String shellCommand, String args, boolean runInShell) {
        return new Job(null, name, frequency, params, null, shellCommand, runInShell, args,
                false, null, null, false, true, List.of(), List.of());
    }

    public boolean hasCommand() { return command != null && !command.isBlank(); }

    public boolean hasShellCommand() { return shellCommand != null && !shellCommand.isBlank(); }

    /** Same predicate the repositories apply in {@code findDue}. */
    public boolean isDueAt(Instant now) {
        return !disabled && !running && nextRun != null && !nextRun.isAfter(now);
    }

    public Job withId(long id) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, running, lastRunSuccessful, infoSubscribers, errorSubscribers);
    }

    public Job withName(String name) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, running, lastRunSuccessful, infoSubscribers, errorSubscribers);
    }

    public Job withRunning(boolean running) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, running, lastRunSuccessful, infoSubscribers, errorSubscribers);
    }

    public Job withOutcome(boolean lastRunSuccessful) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, false, lastRunSuccessful, infoSubscribers, errorSubscribers);
    }

    public Job withSchedule(Instant lastRun, Instant nextRun) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, running, lastRunSuccessful, infoSubscribers, errorSubscribers);
    }

    public Job withDisabled(boolean disabled) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, disabled ? null : nextRun, lastRun, running, lastRunSuccessful,
                infoSubscribers, errorSubscribers);
    }

    public Job withSubscribers(List<Subscriber> info, List<Subscriber> error) {
        return new Job(id, name, frequency, params, command, shellCommand, runInShell, args,
                disabled, nextRun, lastRun, running, lastRunSuccessful, info, error);
    }
}
