package net.cadence.core.spi;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/** Runs a named in-process command. Output goes to the given writers only. */
public interface CommandInvoker {
    void invoke(String command,
                List<String> args,
                Map<String, String> options,
                PrintWriter out,
                PrintWriter err) throws Exception;
}
