package net.cadence.core.exec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

public record CommandInvocation(
        String name,
        List<String> args,
        Map<String, String> options,
        PrintWriter out,
        PrintWriter err
) {
    public String option(String key, String dflt) {
        return options.getOrDefault(key, dflt);
    }
}
