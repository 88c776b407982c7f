package net.cadence.core.model;

public record ExecutionResult(boolean success, String stdout, String stderr) {

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean hasOutput() {
        return !stdout.isEmpty() || !stderr.isEmpty();
    }

    public ExecutionResult appendStderr(String text) {
        return new ExecutionResult(success, stdout, stderr + text);
    }
}
