package it.aw.textoverlap.registry;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Consumatore esterno del database delle sovrapposizioni, lanciato in un processo
 * separato da {@link OverlapDatabaseTest}. Apre il file in sola lettura e conta le run
 * concluse. Stampa {@code OK <n>} o {@code FAILED <messaggio>}.
 */
public final class ExternalReadOnlyClient {

    private ExternalReadOnlyClient() {}

    public static void main(String[] args) {
        Properties props = new Properties();
        props.setProperty("duckdb.read_only", "true");
        try (Connection conn = DriverManager.getConnection(args[0], props);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT count(*) FROM overlap_runs WHERE finished_at IS NOT NULL")) {
            rs.next();
            System.out.println("OK " + rs.getLong(1));
        } catch (SQLException e) {
            System.out.println("FAILED " + e.getMessage());
            System.exit(1);
        }
    }
}
