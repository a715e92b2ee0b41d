package it.aw.textoverlap.registry;

import java.util.List;
import java.util.Set;

/**
 * Schema del database delle sovrapposizioni (DuckDB). Niente FOREIGN KEY né CASCADE:
 * la relazione run → match è garantita dal registry.
 *
 * <h3>passages</h3>
 * Scritta dall'import dei passi; qui solo letta. {@code greek_text} è il testo
 * originale su cui si calcolano gli span lato passo.
 *
 * <h3>overlap_runs</h3>
 * Una riga per passata. {@code finished_at} null = passata in corso o abortita.
 *
 * <h3>overlap_matches</h3>
 * Una riga per coppia (passo, candidato) conservata. Gli offset sono 0-based,
 * fine esclusa, nel testo originale di ciascun lato: {@code *_start/*_end} per il
 * blocco in lettere, {@code *_word_start/*_word_end} per la sequenza di parole
 * (0/0 se nessuna parola è in comune).
 */
final class OverlapSchema {

    static final String PASSAGES_TABLE = "passages";
    static final String RUNS_TABLE     = "overlap_runs";
    static final String MATCHES_TABLE  = "overlap_matches";

    static final Set<String> MATCH_SPAN_COLUMNS = Set.of(
            "passage_start", "passage_end", "candidate_start", "candidate_end",
            "passage_word_start", "passage_word_end", "candidate_word_start", "candidate_word_end");

    static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS passages (
                id           BIGINT   PRIMARY KEY,
                ref          VARCHAR  NOT NULL,
                ref_major    INTEGER,
                ref_minor    INTEGER,
                greek_text   VARCHAR,
                translation  VARCHAR,
                short_label  VARCHAR
            )
            """,
            "CREATE SEQUENCE IF NOT EXISTS overlap_runs_id_seq START 1",
            """
            CREATE TABLE IF NOT EXISTS overlap_runs (
                id               BIGINT    PRIMARY KEY DEFAULT nextval('overlap_runs_id_seq'),
                metric_version   VARCHAR   NOT NULL,
                created_at       TIMESTAMP NOT NULL,
                finished_at      TIMESTAMP,
                passage_count    INTEGER   NOT NULL,
                candidate_count  INTEGER   NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS overlap_matches (
                run_id                BIGINT           NOT NULL,
                passage_id            BIGINT           NOT NULL,
                candidate_id          BIGINT           NOT NULL,
                candidate_ref         VARCHAR,
                candidate_label       VARCHAR,
                char_len              INTEGER          NOT NULL,
                char_ratio            DOUBLE PRECISION NOT NULL,
                word_len              INTEGER          NOT NULL,
                word_ratio            DOUBLE PRECISION NOT NULL,
                passage_start         INTEGER          NOT NULL,
                passage_end           INTEGER          NOT NULL,
                candidate_start       INTEGER          NOT NULL,
                candidate_end         INTEGER          NOT NULL,
                passage_word_start    INTEGER          NOT NULL,
                passage_word_end      INTEGER          NOT NULL,
                candidate_word_start  INTEGER          NOT NULL,
                candidate_word_end    INTEGER          NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS overlap_matches_passage_idx ON overlap_matches (run_id, passage_id)",
            "CREATE INDEX IF NOT EXISTS overlap_matches_candidate_idx ON overlap_matches (run_id, candidate_id)"
    );

    private OverlapSchema() {}
}
