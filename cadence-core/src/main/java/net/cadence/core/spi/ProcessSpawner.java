package net.cadence.core.spi;

import java.io.IOException;
import java.util.List;

/** Starts an external process and blocks until it exits. No timeout. */
public interface ProcessSpawner {
    /** argv[0] is executed directly, without a shell. */
    Output spawn(List<String> argv) throws IOException, InterruptedException;

    /** The line is handed to a shell interpreter. */
    Output spawnShell(String commandLine) throws IOException, InterruptedException;

    record Output(byte[] stdout, byte[] stderr, int exitCode) {}
}
