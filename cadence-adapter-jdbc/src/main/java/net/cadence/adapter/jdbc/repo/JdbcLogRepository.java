package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.Log;
import net.cadence.core.spi.LogRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcLogRepository implements LogRepository {

    public JdbcLogRepository() {}

    @Override
    public Log create(Log log) throws Exception {
        if (log.jobId() == null) throw new IllegalArgumentException("log.jobId is required");
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_JOB_LOG(JOB_ID, RUN_DATE, END_DATE, STDOUT, STDERR, SUCCESS)
                VALUES (?, ?, ?, ?, ?, ?)
            """, new String[]{"ID"})) {
            ps.setLong(1, log.jobId());
            ps.setTimestamp(2, JdbcUtil.ts(log.runDate()));
            ps.setTimestamp(3, JdbcUtil.ts(log.endDate()));
            JdbcUtil.setClob(ps, 4, log.stdout());
            JdbcUtil.setClob(ps, 5, log.stderr());
            ps.setString(6, JdbcUtil.yn(log.success()));
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("TB_JOB_LOG insert returned no key");
                return log.withId(k.getLong(1));
            }
        }
    }

    @Override
    public Optional<Log> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB_LOG WHERE ID = ?")) {
            ps.setLong(1, id);
            return query(ps).stream().findFirst();
        }
    }

    @Override
    public List<Log> findByJob(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB_LOG
                 WHERE JOB_ID = ?
                 ORDER BY RUN_DATE DESC, ID DESC
            """)) {
            ps.setLong(1, jobId);
            return query(ps);
        }
    }

    @Override
    public Optional<Log> findLatest(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB_LOG
                 WHERE JOB_ID = ?
                 ORDER BY RUN_DATE DESC, ID DESC
                 FETCH FIRST 1 ROWS ONLY
            """)) {
            ps.setLong(1, jobId);
            return query(ps).stream().findFirst();
        }
    }

    @Override
    public int deleteRunOnOrBefore(Instant threshold) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "DELETE FROM TB_JOB_LOG WHERE RUN_DATE <= ?")) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }

    private static List<Log> query(PreparedStatement ps) throws SQLException {
        List<Log> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toLog(rs));
        }
        return out;
    }
}
