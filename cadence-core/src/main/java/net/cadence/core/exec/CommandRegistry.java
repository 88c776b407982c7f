package net.cadence.core.exec;

import net.cadence.core.spi.CommandInvoker;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Name → command table; the default {@link CommandInvoker}. */
public final class CommandRegistry implements CommandInvoker {
    private final Map<String, ManagedCommand> commands = new ConcurrentHashMap<>();

    public CommandRegistry() {}

    public CommandRegistry(Map<String, ? extends ManagedCommand> initial) {
        initial.forEach(this::register);
    }

    public CommandRegistry register(String name, ManagedCommand command) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("command name is required");
        commands.put(name, command);
        return this;
    }

    public Set<String> names() { return Set.copyOf(commands.keySet()); }

    @Override
    public void invoke(String command,
                       List<String> args,
                       Map<String, String> options,
                       PrintWriter out,
                       PrintWriter err) throws Exception {
        ManagedCommand cmd = commands.get(command);
        if (cmd == null) throw new UnknownCommandException(command);
        cmd.execute(new CommandInvocation(command, args, options, out, err));
    }
}
