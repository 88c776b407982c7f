package net.cadence.core.exec;

import net.cadence.core.model.ExecutionResult;
import net.cadence.core.model.Job;
import net.cadence.core.spi.CommandInvoker;
import net.cadence.core.spi.ProcessSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs a job's command and captures what it wrote. Never throws: any {@link Throwable}, errors
 * included, ends up in {@link ExecutionResult#stderr()} with {@code success = false}.
 * <p>
 * A job with a shell command runs in shell mode; otherwise its in-process command is invoked.
 * Neither mode has a timeout.
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final CommandInvoker commands;
    private final ProcessSpawner processes;

    public JobExecutor(CommandInvoker commands, ProcessSpawner processes) {
        this.commands = commands;
        this.processes = processes;
    }

    public ExecutionResult execute(Job job) {
        return job.hasShellCommand() ? runShellCommand(job) : runCommand(job);
    }

    ExecutionResult runCommand(Job job) {
        ParsedArguments parsed = ArgumentParser.parse(job.args());
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        String failure = "";
        boolean success;

        try (PrintWriter outWriter = new PrintWriter(out, true);
             PrintWriter errWriter = new PrintWriter(err, true)) {
            try {
                commands.invoke(job.command(), parsed.positional(), parsed.options(), outWriter, errWriter);
                success = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = Tracebacks.format(e);
                success = false;
            } catch (Throwable e) {
                // Errors too (AssertionError, StackOverflowError, linkage errors): the run must still be logged
                log.debug("Command '{}' of job '{}' raised", job.command(), job.name(), e);
                failure = Tracebacks.format(e);
                success = false;
            }
        }
        return new ExecutionResult(success, out.toString(), err + failure);
    }

    ExecutionResult runShellCommand(Job job) {
        String line = job.shellCommand() + " " + job.args();
        String stdout = "";
        String stderr = "";
        boolean success;

        try {
            ProcessSpawner.Output output;
            if (job.runInShell()) {
                output = processes.spawnShell(ShellEscaper.escape(line));
            } else {
                List<String> argv = ShellLexer.split(line);
                output = processes.spawn(argv);
            }
            stdout = new String(output.stdout(), StandardCharsets.UTF_8);
            stderr = new String(output.stderr(), StandardCharsets.UTF_8);
            if (output.exitCode() != 0) {
                stderr += "\n\n*** Process ended with return code " + output.exitCode() + "\n\n";
            }
            success = output.exitCode() == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stderr += Tracebacks.format(e);
            success = false;
        } catch (Throwable e) {
            log.debug("Shell command of job '{}' failed to start", job.name(), e);
            stderr += Tracebacks.format(e);
            success = false;
        }
        return new ExecutionResult(success, stdout, stderr);
    }
}
