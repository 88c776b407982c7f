package net.cadence.core.recurrence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed recurrence parameters, e.g. {@code bysecond:1;byminute:1,2,4,5}.
 * <p>
 * Tokens are separated by {@code ;}. A token that does not split into exactly a key and a value
 * list on {@code :} is dropped without error. Values are comma separated integers.
 */
public final class RecurrenceParams {
    private static final RecurrenceParams EMPTY = new RecurrenceParams(Map.of());

    private final Map<String, List<Integer>> values;

    private RecurrenceParams(Map<String, List<Integer>> values) {
        this.values = values;
    }

    public static RecurrenceParams empty() { return EMPTY; }

    /**
     * @throws RecurrenceParseException when a value is not an integer
     */
    public static RecurrenceParams parse(String text) {
        if (text == null || text.isBlank()) return EMPTY;

        Map<String, List<Integer>> parsed = new LinkedHashMap<>();
        for (String token : text.split(";", -1)) {
            String[] kv = token.split(":", -1);
            if (kv.length != 2) continue; // malformed token, dropped

            String key = kv[0].trim();
            List<Integer> ints = new ArrayList<>();
            for (String raw : kv[1].split(",", -1)) {
                try {
                    ints.add(Integer.parseInt(raw.trim()));
                } catch (NumberFormatException e) {
                    throw new RecurrenceParseException(
                            "Invalid value '" + raw + "' for recurrence parameter '" + key + "'", e);
                }
            }
            parsed.put(key, List.copyOf(ints));
        }
        return parsed.isEmpty() ? EMPTY : new RecurrenceParams(Collections.unmodifiableMap(parsed));
    }

    public boolean isEmpty() { return values.isEmpty(); }

    public Set<String> keys() { return values.keySet(); }

    public boolean has(String key) { return values.containsKey(key); }

    /** All values of {@code key}, or null when absent. */
    public List<Integer> ints(String key) { return values.get(key); }

    /**
     * View where a single value collapses to an {@link Integer} and several stay a {@code List<Integer>}.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        values.forEach((k, v) -> m.put(k, v.size() == 1 ? v.get(0) : v));
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecurrenceParams other && values.equals(other.values);
    }

    @Override
    public int hashCode() { return Objects.hash(values); }

    @Override
    public String toString() { return asMap().toString(); }
}
