package net.cadence.core.exec;

/** Backslash-escapes {@code `}, {@code $} and {@code "} before a line is handed to a shell. */
public final class ShellEscaper {
    private static final String SPECIALS = "`$\"";

    private ShellEscaper() {}

    public static String escape(String command) {
        StringBuilder sb = new StringBuilder(command.length() + 8);
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (SPECIALS.indexOf(c) > -1) sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}
