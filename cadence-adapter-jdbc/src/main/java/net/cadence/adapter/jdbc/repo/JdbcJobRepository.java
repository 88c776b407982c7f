package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.Job;
import net.cadence.core.model.Subscriber;
import net.cadence.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRepository implements JobRepository {
    private static final String KIND_INFO = "I";
    private static final String KIND_ERROR = "E";

    public JdbcJobRepository() {}

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public List<Job> findDue(Instant now) throws Exception {
        // plain read; the running flag set by the runner is the only guard against double runs
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE DISABLED   = 'N'
                   AND IS_RUNNING = 'N'
                   AND NEXT_RUN  <= ?
                 ORDER BY NEXT_RUN, ID
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            return query(ps);
        }
    }

    @Override
    public Optional<Job> findById(long id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return query(ps).stream().findFirst();
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            return query(ps).stream().findFirst();
        }
    }

    @Override
    public List<Job> findAll() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB ORDER BY ID")) {
            return query(ps);
        }
    }

    @Override
    public Job save(Job job) throws Exception {
        Job saved = job.id() == null ? insert(job) : update(job);
        replaceSubscribers(saved.id(), KIND_INFO, saved.infoSubscribers());
        replaceSubscribers(saved.id(), KIND_ERROR, saved.errorSubscribers());
        return saved;
    }

    @Override
    public int disable(Collection<Long> ids) throws Exception {
        if (ids.isEmpty()) return 0;
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET DISABLED   = 'Y',
                       NEXT_RUN   = NULL,
                       UPDATED_AT = SYSTIMESTAMP
                 WHERE ID IN (%s)
            """.formatted(JdbcUtil.placeholders(ids.size())))) {
            JdbcUtil.bindIds(ps, 1, ids);
            return ps.executeUpdate();
        }
    }

    @Override
    public int resetRunning(Collection<Long> ids) throws Exception {
        if (ids.isEmpty()) return 0;
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET IS_RUNNING = 'N',
                       UPDATED_AT = SYSTIMESTAMP
                 WHERE ID IN (%s)
            """.formatted(JdbcUtil.placeholders(ids.size())))) {
            JdbcUtil.bindIds(ps, 1, ids);
            return ps.executeUpdate();
        }
    }

    private Job insert(Job job) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                INSERT INTO TB_JOB(NAME, FREQUENCY, PARAMS, COMMAND, SHELL_COMMAND, RUN_IN_SHELL, ARGS,
                                   DISABLED, NEXT_RUN, LAST_RUN, IS_RUNNING, LAST_RUN_SUCCESSFUL,
                                   CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, SYSTIMESTAMP, SYSTIMESTAMP)
            """, new String[]{"ID"})) {
            bindColumns(ps, job);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("TB_JOB insert returned no key for " + job.name());
                return job.withId(k.getLong(1));
            }
        }
    }

    private Job update(Job job) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME                = ?,
                       FREQUENCY           = ?,
                       PARAMS              = ?,
                       COMMAND             = ?,
                       SHELL_COMMAND       = ?,
                       RUN_IN_SHELL        = ?,
                       ARGS                = ?,
                       DISABLED            = ?,
                       NEXT_RUN            = ?,
                       LAST_RUN            = ?,
                       IS_RUNNING          = ?,
                       LAST_RUN_SUCCESSFUL = ?,
                       UPDATED_AT          = SYSTIMESTAMP
                 WHERE ID = ?
            """)) {
            int next = bindColumns(ps, job);
            ps.setLong(next, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_JOB not found for ID=" + job.id());
            }
            return job;
        }
    }

    private static int bindColumns(PreparedStatement ps, Job job) throws SQLException {
        int i = 1;
        ps.setString(i++, job.name());
        ps.setString(i++, job.frequency().code());
        ps.setString(i++, job.params());
        ps.setString(i++, job.command());
        ps.setString(i++, job.shellCommand());
        ps.setString(i++, JdbcUtil.yn(job.runInShell()));
        ps.setString(i++, job.args());
        ps.setString(i++, JdbcUtil.yn(job.disabled()));
        // a disabled job is never scheduled
        ps.setTimestamp(i++, job.disabled() ? null : JdbcUtil.ts(job.nextRun()));
        ps.setTimestamp(i++, JdbcUtil.ts(job.lastRun()));
        ps.setString(i++, JdbcUtil.yn(job.running()));
        ps.setString(i++, JdbcUtil.yn(job.lastRunSuccessful()));
        return i;
    }

    private void replaceSubscribers(long jobId, String kind, List<Subscriber> subscribers) throws SQLException {
        Connection c = mustConn();
        try (PreparedStatement del = c.prepareStatement("DELETE FROM TB_JOB_SUBSCRIBER WHERE JOB_ID = ? AND KIND = ?")) {
            del.setLong(1, jobId);
            del.setString(2, kind);
            del.executeUpdate();
        }
        if (subscribers.isEmpty()) return;

        try (PreparedStatement ins = c.prepareStatement("""
                INSERT INTO TB_JOB_SUBSCRIBER(JOB_ID, KIND, SEQ, USERNAME, FULL_NAME, EMAIL)
                VALUES (?, ?, ?, ?, ?, ?)
            """)) {
            int seq = 0;
            for (Subscriber s : subscribers) {
                ins.setLong(1, jobId);
                ins.setString(2, kind);
                ins.setInt(3, seq++);
                ins.setString(4, s.username());
                ins.setString(5, s.fullName());
                ins.setString(6, s.email());
                ins.addBatch();
            }
            ins.executeBatch();
        }
    }

    private List<Job> query(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong("ID");
                out.add(RowMappers.toJob(rs, subscribers(id, KIND_INFO), subscribers(id, KIND_ERROR)));
            }
        }
        return out;
    }

    private List<Subscriber> subscribers(long jobId, String kind) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT USERNAME, FULL_NAME, EMAIL
                  FROM TB_JOB_SUBSCRIBER
                 WHERE JOB_ID = ? AND KIND = ?
                 ORDER BY SEQ
            """)) {
            ps.setLong(1, jobId);
            ps.setString(2, kind);
            List<Subscriber> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toSubscriber(rs));
            }
            return out;
        }
    }
}
