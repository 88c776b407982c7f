package net.cadence.core.model;

public class JobConfigurationException extends RuntimeException {
    public JobConfigurationException(String message) {
        super(message);
    }
}
