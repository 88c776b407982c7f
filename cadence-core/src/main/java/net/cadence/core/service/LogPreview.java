package net.cadence.core.service;

import net.cadence.core.model.Log;

/** Short one-line previews of a log's streams for listings. */
public final class LogPreview {
    static final int MAX = 40;

    private LogPreview() {}

    public static String output(Log entry) {
        return preview(entry.stdout(), "(No output)");
    }

    public static String errors(Log entry) {
        return preview(entry.stderr(), "(No errors)");
    }

    private static String preview(String text, String empty) {
        if (text == null || text.isEmpty()) return empty;
        return text.length() > MAX ? text.substring(0, MAX) + "..." : text;
    }
}
