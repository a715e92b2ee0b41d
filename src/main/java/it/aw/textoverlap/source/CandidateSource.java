package it.aw.textoverlap.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Candidati del secondo corpus, mantenuto da un altro team in un database separato.
 * <p>
 * File DuckDB aperto in sola lettura ({@code duckdb.read_only}), con una connessione
 * aperta e chiusa a ogni lettura: il servizio non tiene lock sul database altrui.
 * Sono letti solo i testi <em>correnti</em> della famiglia {@code candidates.source-document}.
 */
@Component
public class CandidateSource implements TextSource {

    private static final Logger log = LoggerFactory.getLogger(CandidateSource.class);

    private static final String DUCKDB_PREFIX = "jdbc:duckdb:";
    private static final String DUCKDB_READ_ONLY = "duckdb.read_only";

    private static final String SELECT_CURRENT = """
            SELECT l.id, l.lemma, l.meineke_id, v.text_body
            FROM assembled_lemmas l
            JOIN lemma_source_text_versions v
              ON v.lemma_id = l.id
            WHERE v.source_document = ?
              AND v.is_current = TRUE
              AND v.text_body IS NOT NULL
            ORDER BY l.id
            """;

    private final String jdbcUrl;
    private final boolean readOnly;
    private final String sourceDocument;

    public CandidateSource(@Value("${candidates.url}") String jdbcUrl,
                           @Value("${candidates.read-only:true}") boolean readOnly,
                           @Value("${candidates.source-document:meineke}") String sourceDocument) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(DUCKDB_PREFIX)) {
            throw new IllegalArgumentException("candidates.url deve essere un URL " + DUCKDB_PREFIX + "...: " + jdbcUrl);
        }
        this.jdbcUrl = jdbcUrl;
        this.readOnly = readOnly;
        this.sourceDocument = sourceDocument;
    }

    @Override
    public String name() {
        return "candidates(" + sourceDocument + ")";
    }

    @Override
    public List<SourceText> fetchAll() {
        List<SourceText> result = new ArrayList<>();
        try (Connection conn = open();
             PreparedStatement ps = conn.prepareStatement(SELECT_CURRENT)) {
            ps.setString(1, sourceDocument);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new SourceText(
                            rs.getLong("id"),
                            rs.getString("meineke_id"),
                            rs.getString("lemma"),
                            rs.getString("text_body")));
                }
            }
        } catch (SQLException e) {
            throw new SourceUnavailableException("Errore lettura candidati da " + jdbcUrl, e);
        }
        log.info("CandidateSource: letti {} candidati correnti ({}) da {}", result.size(), sourceDocument, jdbcUrl);
        return result;
    }

    private Connection open() throws SQLException {
        Properties props = new Properties();
        if (readOnly) {
            props.setProperty(DUCKDB_READ_ONLY, "true");
        }
        return DriverManager.getConnection(jdbcUrl, props);
    }
}
