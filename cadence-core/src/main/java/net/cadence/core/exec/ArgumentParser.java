package net.cadence.core.exec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a job's argument string for in-process commands: {@code "arg1 option1=True"} gives
 * positional {@code [arg1]} and options {@code {option1=True}}.
 * <p>
 * Tokens are whitespace separated, with no quoting. A token containing {@code =} is split on the
 * first {@code =} only, so a key can never contain {@code =}.
 */
public final class ArgumentParser {
    private ArgumentParser() {}

    public static ParsedArguments parse(String args) {
        List<String> positional = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        if (args == null || args.isBlank()) return new ParsedArguments(positional, options);

        for (String token : args.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq > -1) {
                options.put(token.substring(0, eq), token.substring(eq + 1));
            } else {
                positional.add(token);
            }
        }
        return new ParsedArguments(positional, options);
    }
}
