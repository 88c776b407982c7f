package net.cadence.core.model;

/** Entry-point checks; the runner assumes a job has passed them. */
public final class JobDefinitions {
    private JobDefinitions() {}

    public static Job validate(Job job) {
        if (job.name() == null || job.name().isBlank()) {
            throw new JobConfigurationException("job.name is required");
        }
        if (job.hasCommand() && job.hasShellCommand()) {
            throw new JobConfigurationException(
                    "job '" + job.name() + "': can't specify a shell command if a command is already specified");
        }
        if (!job.hasCommand() && !job.hasShellCommand()) {
            throw new JobConfigurationException(
                    "job '" + job.name() + "': must specify either command or shell command");
        }
        return job;
    }
}
