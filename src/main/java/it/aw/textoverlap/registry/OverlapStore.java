package it.aw.textoverlap.registry;

import it.aw.textoverlap.model.CorpusCounts;
import it.aw.textoverlap.model.OverlapMatch;
import it.aw.textoverlap.model.OverlapRun;

import java.util.List;
import java.util.Optional;

/**
 * Contratto di persistenza delle run e dei match.
 * <p>
 * Scrittura (solo l'orchestratore): {@link #createRun}, {@link #insertMatches},
 * {@link #finalizeRun}, {@link #purgeIncompleteRuns}.
 * <p>
 * Lettura (UI, consumatori esterni): sempre e solo attraverso l'ultima run
 * <em>completata</em> di una versione della metrica; una run con {@code finished_at}
 * null non è mai visibile, qualunque numero di match abbia scritto.
 * <p>
 * Tutti i metodi lanciano {@link StoreUnavailableException} se lo store non risponde.
 */
public interface OverlapStore {

    /** Apre una nuova run non completata e ne restituisce la riga. */
    OverlapRun createRun(String metricVersion, CorpusCounts counts);

    /** Inserisce in blocco i match della run, in un'unica transazione. */
    void insertMatches(long runId, List<OverlapMatch> matches);

    /** Marca la run come completata e ne aggiorna i conteggi. */
    OverlapRun finalizeRun(long runId, CorpusCounts counts);

    /**
     * Elimina i match delle run mai completate della versione indicata.
     * Le righe delle run restano, per audit.
     *
     * @return numero di match eliminati
     */
    int purgeIncompleteRuns(String metricVersion);

    Optional<OverlapRun> findRun(long runId);

    /** Tutte le run della versione, completate e no, dalla più recente. */
    List<OverlapRun> findRuns(String metricVersion);

    /** Ultima run con {@code finished_at} valorizzato per la versione. */
    Optional<OverlapRun> findLatestCompletedRun(String metricVersion);

    /** Match di un passo nell'ultima run completata, ordinati come in scrittura. */
    List<OverlapMatch> findLatestMatchesByPassage(String metricVersion, long passageId);

    /** Match di un candidato nell'ultima run completata, stesso ordinamento, poi per passo. */
    List<OverlapMatch> findLatestMatchesByCandidate(String metricVersion, long candidateId);
}
