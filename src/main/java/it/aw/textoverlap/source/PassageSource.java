package it.aw.textoverlap.source;

import it.aw.textoverlap.registry.OverlapDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Passi del corpus principale, letti dalla tabella {@code passages} del database
 * del servizio (popolata dall'import, qui mai modificata).
 * <p>
 * Esclude i testi nulli e i riferimenti in {@code passages.excluded-refs};
 * ordina per riferimento numerico (maggiore, minore) e poi testuale.
 * Con {@code overlap.passage-limit} > 0 legge solo i primi N passi.
 */
@Component
public class PassageSource implements TextSource {

    private static final Logger log = LoggerFactory.getLogger(PassageSource.class);

    private final OverlapDatabase database;
    private final List<String> excludedRefs;
    private final int limit;

    public PassageSource(OverlapDatabase database,
                         @Value("${passages.excluded-refs:E}") String[] excludedRefs,
                         @Value("${overlap.passage-limit:0}") int limit) {
        this.database = database;
        this.excludedRefs = Arrays.stream(excludedRefs)
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        this.limit = limit;
    }

    @Override
    public String name() {
        return "passages";
    }

    @Override
    public List<SourceText> fetchAll() {
        StringBuilder sql = new StringBuilder(
                "SELECT id, ref, short_label, greek_text FROM passages WHERE greek_text IS NOT NULL");
        if (!excludedRefs.isEmpty()) {
            sql.append(" AND ref NOT IN (")
               .append(String.join(", ", Collections.nCopies(excludedRefs.size(), "?")))
               .append(')');
        }
        sql.append(" ORDER BY ref_major NULLS LAST, ref_minor NULLS LAST, ref");
        if (limit > 0) sql.append(" LIMIT ?");

        try {
            List<SourceText> passages = database.withConnection(conn -> {
                List<SourceText> result = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                    int p = 1;
                    for (String ref : excludedRefs) ps.setString(p++, ref);
                    if (limit > 0) ps.setInt(p, limit);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            result.add(new SourceText(
                                    rs.getLong("id"),
                                    rs.getString("ref"),
                                    rs.getString("short_label"),
                                    rs.getString("greek_text")));
                        }
                    }
                }
                return result;
            });
            log.info("PassageSource: letti {} passi da {}", passages.size(), database.url());
            return passages;
        } catch (SQLException e) {
            throw new SourceUnavailableException("Errore lettura passi da " + database.url(), e);
        }
    }
}
