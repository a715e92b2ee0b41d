package it.aw.textoverlap.source;

import it.aw.textoverlap.registry.OverlapDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassageSourceTest {

    @TempDir
    Path tempDir;

    private OverlapDatabase database;

    @BeforeEach
    void setUp() throws Exception {
        database = new OverlapDatabase("jdbc:duckdb:" + tempDir.resolve("overlap.duckdb"));
        database.init();
        database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                        INSERT INTO passages (id, ref, ref_major, ref_minor, greek_text, short_label) VALUES
                            (1, '10.2', 10, 2, 'ὁ λόγος',      'Logos'),
                            (2, '2.1',  2,  1, 'ἐν ἀρχῇ',       'Arche'),
                            (3, 'E',    NULL, NULL, 'εἰσαγωγή', 'Intro'),
                            (4, '2.3',  2,  3, NULL,            'Vuoto'),
                            (5, 'app',  NULL, NULL, 'παράρτημα', NULL),
                            (6, '10.1', 10, 1, 'καὶ θεὸς',      'Theos')
                        """);
            }
            return null;
        });
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void fetchAll_shouldSkipNullTextsAndExcludedRefsInReferenceOrder() {
        PassageSource source = new PassageSource(database, new String[]{"E"}, 0);

        List<SourceText> passages = source.fetchAll();

        assertThat(passages).extracting(SourceText::id).containsExactly(2L, 6L, 1L, 5L);
        SourceText first = passages.get(0);
        assertThat(first.reference()).isEqualTo("2.1");
        assertThat(first.label()).isEqualTo("Arche");
        assertThat(first.text()).isEqualTo("ἐν ἀρχῇ");
    }

    @Test
    void fetchAll_emptyExclusionListShouldKeepEveryTextualPassage() {
        PassageSource source = new PassageSource(database, new String[]{" "}, 0);

        assertThat(source.fetchAll()).extracting(SourceText::id).contains(3L).hasSize(5);
    }

    @Test
    void fetchAll_limitShouldReadOnlyTheFirstPassages() {
        PassageSource source = new PassageSource(database, new String[]{"E", "app"}, 2);

        assertThat(source.fetchAll()).extracting(SourceText::id).containsExactly(2L, 6L);
    }

    @Test
    void fetchAll_closedDatabaseShouldSurfaceSourceUnavailable() {
        PassageSource source = new PassageSource(database, new String[]{"E"}, 0);
        database.close();

        assertThatThrownBy(source::fetchAll).isInstanceOf(SourceUnavailableException.class);
    }
}
