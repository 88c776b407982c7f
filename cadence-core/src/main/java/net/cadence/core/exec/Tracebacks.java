package net.cadence.core.exec;

import java.io.PrintWriter;
import java.io.StringWriter;

final class Tracebacks {
    private Tracebacks() {}

    /** Message plus full stack trace, the form folded into a run's stderr. */
    static String format(Throwable t) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            pw.println();
            pw.println("Error: " + (t.getMessage() == null ? t.getClass().getName() : t.getMessage()));
            pw.println();
            pw.println("Traceback:");
            t.printStackTrace(pw);
        }
        return sw.toString();
    }
}
