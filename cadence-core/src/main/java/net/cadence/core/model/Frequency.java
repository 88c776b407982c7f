package net.cadence.core.model;

public enum Frequency {
    YEARLY, MONTHLY, WEEKLY, DAILY, HOURLY, MINUTELY, SECONDLY;

    /** Unknown or missing codes fall back to DAILY. */
    public static Frequency from(String s) {
        if (s == null) return DAILY;
        try { return Frequency.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return DAILY; }
    }

    public String code() { return name(); }

    /** true when this frequency steps in units coarser than {@code other} (YEARLY is coarsest). */
    public boolean coarserThan(Frequency other) { return ordinal() < other.ordinal(); }
}
