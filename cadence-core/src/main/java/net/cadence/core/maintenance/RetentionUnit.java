package net.cadence.core.maintenance;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum RetentionUnit {
    WEEKS(Duration.ofDays(7)),
    DAYS(Duration.ofDays(1)),
    HOURS(Duration.ofHours(1)),
    MINUTES(Duration.ofMinutes(1));

    private final Duration unit;

    RetentionUnit(Duration unit) {
        this.unit = unit;
    }

    public Duration times(long amount) {
        return unit.multipliedBy(amount);
    }

    /** Case-insensitive lookup; {@code weeks}, {@code DAYS}, ... */
    public static RetentionUnit from(String name) {
        if (name != null) {
            for (RetentionUnit u : values()) {
                if (u.name().equalsIgnoreCase(name.trim())) return u;
            }
        }
        throw new IllegalArgumentException("Unknown retention unit '" + name + "', expected one of " + choices());
    }

    public static String choices() {
        return Arrays.stream(values())
                .map(u -> u.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }
}
