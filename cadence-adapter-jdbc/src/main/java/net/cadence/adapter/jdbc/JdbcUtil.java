package net.cadence.adapter.jdbc;

import java.io.StringReader;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** Oracle stores '' as NULL; read back as empty. */
    public static String nz(String s) { return s == null ? "" : s; }

    public static void setClob(PreparedStatement ps, int idx, String text) throws SQLException {
        if (text == null || text.isEmpty()) {
            ps.setNull(idx, Types.CLOB);
        } else {
            ps.setCharacterStream(idx, new StringReader(text), text.length());
        }
    }

    /** {@code ?, ?, ?} for an IN list. */
    public static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    public static int bindIds(PreparedStatement ps, int start, Collection<Long> ids) throws SQLException {
        int i = start;
        for (Long id : ids) ps.setLong(i++, id);
        return i;
    }
}
