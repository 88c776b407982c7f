package net.cadence.adapter.jdbc.mapper;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.core.model.Frequency;
import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.model.Subscriber;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

public final class RowMappers {
    private RowMappers() {}

    // --- Job (subscribers are loaded separately) ---
    public static Job toJob(ResultSet rs, List<Subscriber> info, List<Subscriber> error) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                Frequency.from(rs.getString("FREQUENCY")),
                JdbcUtil.nz(rs.getString("PARAMS")),
                rs.getString("COMMAND"),
                rs.getString("SHELL_COMMAND"),
                JdbcUtil.isY(rs.getString("RUN_IN_SHELL")),
                JdbcUtil.nz(rs.getString("ARGS")),
                JdbcUtil.isY(rs.getString("DISABLED")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN")),
                JdbcUtil.isY(rs.getString("IS_RUNNING")),
                JdbcUtil.isY(rs.getString("LAST_RUN_SUCCESSFUL")),
                info,
                error
        );
    }

    // --- Subscriber ---
    public static Subscriber toSubscriber(ResultSet rs) throws SQLException {
        return new Subscriber(
                rs.getString("USERNAME"),
                rs.getString("FULL_NAME"),
                rs.getString("EMAIL")
        );
    }

    // --- Log ---
    public static Log toLog(ResultSet rs) throws SQLException {
        return new Log(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                rs.getTimestamp("RUN_DATE").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("END_DATE")),
                rs.getString("STDOUT"),
                rs.getString("STDERR"),
                JdbcUtil.isY(rs.getString("SUCCESS"))
        );
    }
}
