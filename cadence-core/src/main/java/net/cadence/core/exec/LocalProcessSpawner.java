package net.cadence.core.exec;

import net.cadence.core.spi.ProcessSpawner;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * {@link ProcessBuilder} backed spawner. Shell lines go through {@code /bin/sh -c}.
 * <p>
 * stdout is read on the calling thread and stderr on a dedicated thread per process, so neither
 * pipe can fill up while the other is being read.
 */
public final class LocalProcessSpawner implements ProcessSpawner {
    private final String shell;

    public LocalProcessSpawner() {
        this("/bin/sh");
    }

    public LocalProcessSpawner(String shell) {
        this.shell = shell;
    }

    @Override
    public Output spawn(List<String> argv) throws IOException, InterruptedException {
        if (argv.isEmpty()) throw new IOException("empty command");
        return run(new ProcessBuilder(argv));
    }

    @Override
    public Output spawnShell(String commandLine) throws IOException, InterruptedException {
        return run(new ProcessBuilder(shell, "-c", commandLine));
    }

    private Output run(ProcessBuilder pb) throws IOException, InterruptedException {
        Process process = pb.redirectInput(ProcessBuilder.Redirect.PIPE).start();
        process.getOutputStream().close();

        FutureTask<byte[]> err = new FutureTask<>(() -> readAll(process.getErrorStream()));
        Thread drain = new Thread(err, "cadence-stderr-" + process.pid());
        drain.setDaemon(true);
        drain.start();

        byte[] out;
        try (InputStream in = process.getInputStream()) {
            out = in.readAllBytes();
        }
        int exit = process.waitFor();
        try {
            return new Output(out, err.get(), exit);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) throw io;
            throw new IOException("failed to read stderr", e.getCause());
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }
}
