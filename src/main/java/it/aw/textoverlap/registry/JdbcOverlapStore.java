package it.aw.textoverlap.registry;

import it.aw.textoverlap.model.CorpusCounts;
import it.aw.textoverlap.model.MatchRanking;
import it.aw.textoverlap.model.OverlapMatch;
import it.aw.textoverlap.model.OverlapRun;
import it.aw.textoverlap.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Implementazione JDBC di {@link OverlapStore} sul database condiviso
 * {@link OverlapDatabase}.
 * <p>
 * L'inserimento dei match avviene in un'unica transazione, a blocchi di
 * {@value #BATCH_SIZE} righe. La visibilità ai lettori è comunque governata da
 * {@code finished_at}: finché la run non è finalizzata i suoi match non compaiono
 * in nessuna lettura.
 */
@Component
public class JdbcOverlapStore implements OverlapStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcOverlapStore.class);

    static final int BATCH_SIZE = 5000;

    private static final String LATEST_COMPLETED_RUN_ID = """
            SELECT id FROM overlap_runs
            WHERE metric_version = ? AND finished_at IS NOT NULL
            ORDER BY finished_at DESC, id DESC
            LIMIT 1
            """;

    private static final String INSERT_MATCH = """
            INSERT INTO overlap_matches
                (run_id, passage_id, candidate_id, candidate_ref, candidate_label,
                 char_len, char_ratio, word_len, word_ratio,
                 passage_start, passage_end, candidate_start, candidate_end,
                 passage_word_start, passage_word_end, candidate_word_start, candidate_word_end)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final OverlapDatabase database;
    private final Clock clock;

    public JdbcOverlapStore(OverlapDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public OverlapRun createRun(String metricVersion, CorpusCounts counts) {
        LocalDateTime createdAt = now();
        try {
            long id = database.withTransaction(conn -> {
                long runId;
                try (PreparedStatement ps = conn.prepareStatement("SELECT nextval('overlap_runs_id_seq')");
                     ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    runId = rs.getLong(1);
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO overlap_runs
                            (id, metric_version, created_at, finished_at, passage_count, candidate_count)
                        VALUES (?, ?, ?, NULL, ?, ?)
                        """)) {
                    ps.setLong(1, runId);
                    ps.setString(2, metricVersion);
                    ps.setTimestamp(3, Timestamp.valueOf(createdAt));
                    ps.setInt(4, counts.passages());
                    ps.setInt(5, counts.candidates());
                    ps.executeUpdate();
                }
                return runId;
            });
            return new OverlapRun(id, metricVersion, createdAt, null, counts.passages(), counts.candidates());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore creazione run (" + metricVersion + ")", e);
        }
    }

    @Override
    public void insertMatches(long runId, List<OverlapMatch> matches) {
        if (matches.isEmpty()) return;
        try {
            database.withTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(INSERT_MATCH)) {
                    int pending = 0;
                    for (OverlapMatch m : matches) {
                        ps.setLong(1, runId);
                        ps.setLong(2, m.passageId());
                        ps.setLong(3, m.candidateId());
                        setNullableString(ps, 4, m.candidateReference());
                        setNullableString(ps, 5, m.candidateLabel());
                        ps.setInt(6, m.charLength());
                        ps.setDouble(7, m.charRatio());
                        ps.setInt(8, m.wordLength());
                        ps.setDouble(9, m.wordRatio());
                        ps.setInt(10, m.passageSpan().start());
                        ps.setInt(11, m.passageSpan().end());
                        ps.setInt(12, m.candidateSpan().start());
                        ps.setInt(13, m.candidateSpan().end());
                        ps.setInt(14, m.passageWordSpan().start());
                        ps.setInt(15, m.passageWordSpan().end());
                        ps.setInt(16, m.candidateWordSpan().start());
                        ps.setInt(17, m.candidateWordSpan().end());
                        ps.addBatch();
                        if (++pending == BATCH_SIZE) {
                            ps.executeBatch();
                            pending = 0;
                        }
                    }
                    if (pending > 0) ps.executeBatch();
                }
                return null;
            });
            log.debug("Run {}: inseriti {} match", runId, matches.size());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore inserimento match della run " + runId, e);
        }
    }

    @Override
    public OverlapRun finalizeRun(long runId, CorpusCounts counts) {
        LocalDateTime finishedAt = now();
        try {
            int updated = database.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE overlap_runs
                        SET finished_at = ?, passage_count = ?, candidate_count = ?
                        WHERE id = ?
                        """)) {
                    ps.setTimestamp(1, Timestamp.valueOf(finishedAt));
                    ps.setInt(2, counts.passages());
                    ps.setInt(3, counts.candidates());
                    ps.setLong(4, runId);
                    return ps.executeUpdate();
                }
            });
            if (updated == 0) {
                throw new IllegalStateException("run " + runId + " inesistente: impossibile finalizzarla");
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore finalizzazione run " + runId, e);
        }
        return findRun(runId).orElseThrow();
    }

    @Override
    public int purgeIncompleteRuns(String metricVersion) {
        try {
            return database.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("""
                        DELETE FROM overlap_matches
                        WHERE run_id IN (
                            SELECT id FROM overlap_runs
                            WHERE metric_version = ? AND finished_at IS NULL
                        )
                        """)) {
                    ps.setString(1, metricVersion);
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore pulizia run incomplete (" + metricVersion + ")", e);
        }
    }

    @Override
    public Optional<OverlapRun> findRun(long runId) {
        try {
            return database.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM overlap_runs WHERE id = ?")) {
                    ps.setLong(1, runId);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? Optional.of(toRun(rs)) : Optional.<OverlapRun>empty();
                    }
                }
            });
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore lettura run " + runId, e);
        }
    }

    @Override
    public List<OverlapRun> findRuns(String metricVersion) {
        try {
            return database.withConnection(conn -> {
                List<OverlapRun> result = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM overlap_runs WHERE metric_version = ? ORDER BY created_at DESC, id DESC")) {
                    ps.setString(1, metricVersion);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) result.add(toRun(rs));
                    }
                }
                return result;
            });
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore lettura run (" + metricVersion + ")", e);
        }
    }

    @Override
    public Optional<OverlapRun> findLatestCompletedRun(String metricVersion) {
        try {
            return database.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT r.* FROM overlap_runs r JOIN (" + LATEST_COMPLETED_RUN_ID + ") l ON l.id = r.id")) {
                    ps.setString(1, metricVersion);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? Optional.of(toRun(rs)) : Optional.<OverlapRun>empty();
                    }
                }
            });
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore lettura ultima run (" + metricVersion + ")", e);
        }
    }

    @Override
    public List<OverlapMatch> findLatestMatchesByPassage(String metricVersion, long passageId) {
        return findLatestMatches(metricVersion, "m.passage_id", passageId, MatchRanking.SQL_ORDER);
    }

    @Override
    public List<OverlapMatch> findLatestMatchesByCandidate(String metricVersion, long candidateId) {
        return findLatestMatches(metricVersion, "m.candidate_id", candidateId,
                MatchRanking.SQL_ORDER + ", passage_id ASC");
    }

    private List<OverlapMatch> findLatestMatches(String metricVersion, String keyColumn, long key, String order) {
        String sql = "SELECT m.* FROM overlap_matches m JOIN (" + LATEST_COMPLETED_RUN_ID + ") l ON l.id = m.run_id "
                + "WHERE " + keyColumn + " = ? ORDER BY " + order;
        try {
            return database.withConnection(conn -> {
                List<OverlapMatch> result = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, metricVersion);
                    ps.setLong(2, key);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) result.add(toMatch(rs));
                    }
                }
                return result;
            });
        } catch (SQLException e) {
            throw new StoreUnavailableException("Errore lettura match (" + keyColumn + "=" + key + ")", e);
        }
    }

    private LocalDateTime now() {
        // DuckDB conserva i microsecondi; i millisecondi bastano e restano stabili in lettura
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) ps.setNull(index, Types.VARCHAR);
        else ps.setString(index, value);
    }

    private static OverlapRun toRun(ResultSet rs) throws SQLException {
        Timestamp finished = rs.getTimestamp("finished_at");
        return new OverlapRun(
                rs.getLong("id"),
                rs.getString("metric_version"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                finished != null ? finished.toLocalDateTime() : null,
                rs.getInt("passage_count"),
                rs.getInt("candidate_count")
        );
    }

    private static OverlapMatch toMatch(ResultSet rs) throws SQLException {
        return new OverlapMatch(
                rs.getLong("run_id"),
                rs.getLong("passage_id"),
                rs.getLong("candidate_id"),
                rs.getString("candidate_ref"),
                rs.getString("candidate_label"),
                rs.getInt("char_len"),
                rs.getDouble("char_ratio"),
                rs.getInt("word_len"),
                rs.getDouble("word_ratio"),
                new TextSpan(rs.getInt("passage_start"), rs.getInt("passage_end")),
                new TextSpan(rs.getInt("candidate_start"), rs.getInt("candidate_end")),
                new TextSpan(rs.getInt("passage_word_start"), rs.getInt("passage_word_end")),
                new TextSpan(rs.getInt("candidate_word_start"), rs.getInt("candidate_word_end"))
        );
    }
}
