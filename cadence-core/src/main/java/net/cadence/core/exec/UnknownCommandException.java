package net.cadence.core.exec;

public class UnknownCommandException extends Exception {
    public UnknownCommandException(String name) {
        super("Unknown command: '" + name + "'");
    }
}
