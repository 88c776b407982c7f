package net.cadence.core.exec;

import java.util.List;
import java.util.Map;

public record ParsedArguments(List<String> positional, Map<String, String> options) {
    public ParsedArguments {
        positional = List.copyOf(positional);
        options = Map.copyOf(options);
    }
}
