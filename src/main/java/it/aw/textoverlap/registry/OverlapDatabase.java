package it.aw.textoverlap.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

/**
 * Database proprio del servizio (file DuckDB): tabella dei passi (popolata dall'import),
 * tabella delle run e tabella dei match.
 * <p>
 * Nessuna connessione resta aperta tra un'unità di lavoro e l'altra: ogni
 * {@link #withConnection} / {@link #withTransaction} apre il file, esegue e lo chiude.
 * DuckDB blocca il file per tutto il processo che lo tiene aperto, quindi tenerlo
 * aperto per l'intera vita del servizio escluderebbe i lettori esterni. Così un
 * consumatore con accesso in sola lettura ({@code duckdb.read_only}) può aprire il file
 * ogni volta che il servizio non sta leggendo o scrivendo, compresa tutta la fase di
 * calcolo di una passata. Vale anche il contrario: un lettore esterno che tiene il file
 * aperto fa fallire la scrittura in corso con {@link StoreUnavailableException}.
 * <p>
 * Le unità di lavoro sono serializzate all'interno del processo.
 * <p>
 * Migrazione schema: se la tabella {@code overlap_matches} esiste ma non ha tutte le
 * colonne degli span, viene ricreata. I match delle run precedenti vanno ricalcolati.
 */
@Component
public class OverlapDatabase {

    private static final Logger log = LoggerFactory.getLogger(OverlapDatabase.class);

    private static final String DUCKDB_PREFIX = "jdbc:duckdb:";

    private final String jdbcUrl;
    private volatile boolean open;

    /** Unità di lavoro su una connessione aperta per l'occasione. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    public OverlapDatabase(@Value("${store.overlap.url}") String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        Path file = databaseFile(jdbcUrl);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        try (Connection conn = DriverManager.getConnection(jdbcUrl)) {
            migrateIfNeeded(conn);
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : OverlapSchema.DDL) {
                    stmt.execute(ddl);
                }
            }
        }
        open = true;
        log.info("OverlapDatabase: schema pronto su {}", jdbcUrl);
    }

    /** Rileva una tabella dei match senza span e la ricrea. */
    private static void migrateIfNeeded(Connection conn) throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = ?")) {
            ps.setString(1, OverlapSchema.MATCHES_TABLE);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        if (!existing.isEmpty() && !existing.containsAll(OverlapSchema.MATCH_SPAN_COLUMNS)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS " + OverlapSchema.MATCHES_TABLE);
            }
            log.warn("OverlapDatabase: tabella '{}' senza colonne span, ricreata. " +
                     "Le run precedenti restano senza match.", OverlapSchema.MATCHES_TABLE);
        }
    }

    /** Da qui in poi ogni unità di lavoro fallisce. */
    @PreDestroy
    public void close() {
        open = false;
    }

    /** Esegue il lavoro in autocommit. */
    public synchronized <T> T withConnection(SqlWork<T> work) throws SQLException {
        try (Connection c = connect()) {
            return work.apply(c);
        }
    }

    /**
     * Esegue il lavoro in un'unica transazione: commit se termina, rollback se lancia.
     */
    public synchronized <T> T withTransaction(SqlWork<T> work) throws SQLException {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    c.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        }
    }

    public String url() {
        return jdbcUrl;
    }

    private Connection connect() throws SQLException {
        if (!open) {
            throw new SQLException("database " + jdbcUrl + " non inizializzato o già chiuso");
        }
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * File DuckDB indicato dall'URL. Un database in memoria sparirebbe a ogni
     * chiusura di connessione, quindi non è ammesso.
     */
    static Path databaseFile(String url) {
        if (url == null || !url.startsWith(DUCKDB_PREFIX)) {
            throw new IllegalArgumentException("store.overlap.url deve essere un URL " + DUCKDB_PREFIX + "...: " + url);
        }
        String location = url.substring(DUCKDB_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) location = location.substring(0, query);
        if (location.isEmpty() || location.startsWith(":memory:")) {
            throw new IllegalArgumentException("store.overlap.url deve indicare un file, non un database in memoria: " + url);
        }
        return Paths.get(location);
    }
}
