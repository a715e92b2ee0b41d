package it.aw.textoverlap.service;

import it.aw.textoverlap.model.CorpusCounts;
import it.aw.textoverlap.model.MatchRanking;
import it.aw.textoverlap.model.MatchThresholds;
import it.aw.textoverlap.model.NormalizedStream;
import it.aw.textoverlap.model.OverlapMatch;
import it.aw.textoverlap.model.OverlapResult;
import it.aw.textoverlap.model.OverlapRun;
import it.aw.textoverlap.model.RunParams;
import it.aw.textoverlap.model.RunReport;
import it.aw.textoverlap.registry.OverlapStore;
import it.aw.textoverlap.source.SourceText;
import it.aw.textoverlap.source.TextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Esegue una passata completa di calcolo delle sovrapposizioni.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Lettura dei due corpora (passi e candidati), ognuno dalla propria sorgente</li>
 *   <li>Pulizia dei match di run precedenti mai completate</li>
 *   <li>Creazione della run, con {@code finished_at} null e i conteggi dei corpora</li>
 *   <li>Normalizzazione dei candidati, una volta sola, e indice degli shingle</li>
 *   <li>Per ogni passo, in parallelo: normalizzazione, confronto con i candidati
 *       che superano il pre-filtro, soglie, taglio top-K</li>
 *   <li>Inserimento in blocco dei match conservati</li>
 *   <li>Finalizzazione della run: da qui i match diventano visibili</li>
 * </ol>
 * Errori su un singolo testo saltano quel testo e la passata continua.
 * Errori di sorgente o di store interrompono la passata: la run resta incompleta
 * e sarà superata dalla passata successiva, che riparte da zero.
 */
@Service
public class OverlapOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(OverlapOrchestrator.class);

    private static final int PROGRESS_EVERY = 25;

    private final TextSource passageSource;
    private final TextSource candidateSource;
    private final OverlapStore store;
    private final MatchThresholds thresholds;
    private final Executor executor;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    public OverlapOrchestrator(@Qualifier("passageSource") TextSource passageSource,
                               @Qualifier("candidateSource") TextSource candidateSource,
                               OverlapStore store,
                               MatchThresholds thresholds,
                               @Qualifier("overlapExecutor") Executor executor,
                               Clock clock) {
        this.passageSource = passageSource;
        this.candidateSource = candidateSource;
        this.store = store;
        this.thresholds = thresholds;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Esegue una passata con i parametri dati.
     *
     * @throws RunInProgressException se una passata per la stessa versione è già in corso
     * @throws RunAbortedException    se la passata viene interrotta
     * @throws it.aw.textoverlap.source.SourceUnavailableException   se un corpus non è leggibile
     * @throws it.aw.textoverlap.registry.StoreUnavailableException  se lo store non risponde
     */
    public RunReport run(RunParams params) {
        ReentrantLock lock = runLocks.computeIfAbsent(params.metricVersion(), v -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new RunInProgressException(params.metricVersion());
        }
        try {
            return doRun(params);
        } finally {
            lock.unlock();
        }
    }

    private RunReport doRun(RunParams params) {
        Instant started = clock.instant();
        String metricVersion = params.metricVersion();

        List<SourceText> passages = passageSource.fetchAll();
        List<SourceText> candidates = candidateSource.fetchAll();
        CorpusCounts counts = new CorpusCounts(passages.size(), candidates.size());

        int purged = store.purgeIncompleteRuns(metricVersion);
        if (purged > 0) {
            log.info("Eliminati {} match di run incomplete ({})", purged, metricVersion);
        }

        OverlapRun run = store.createRun(metricVersion, counts);
        MDC.put("runId", String.valueOf(run.id()));
        MDC.put("metricVersion", metricVersion);
        try {
            log.info("Run {} avviata: {} passi x {} candidati, K={}, soglie {}/{}",
                    run.id(), counts.passages(), counts.candidates(), params.maxMatchesPerPassage(),
                    thresholds.minCharLength(), thresholds.minWordLength());

            List<SourceText> usableCandidates = new ArrayList<>(candidates.size());
            List<NormalizedStream> candidateStreams = new ArrayList<>(candidates.size());
            for (SourceText candidate : candidates) {
                try {
                    candidateStreams.add(GreekNormalizer.normalize(candidate.text()));
                    usableCandidates.add(candidate);
                } catch (RuntimeException e) {
                    log.warn("Candidato {} ({}) saltato: {}", candidate.id(), candidate.reference(), e.getMessage());
                }
            }
            int skippedCandidates = candidates.size() - usableCandidates.size();
            ShingleIndex index = ShingleIndex.build(candidateStreams, thresholds);

            List<CompletableFuture<PassageOutcome>> futures = new ArrayList<>(passages.size());
            for (SourceText passage : passages) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> matchPassage(run.id(), passage, usableCandidates, candidateStreams, index,
                                params.maxMatchesPerPassage()),
                        executor));
            }

            List<OverlapMatch> retained = new ArrayList<>();
            int skippedPassages = 0;
            for (int i = 0; i < futures.size(); i++) {
                PassageOutcome outcome = await(run, futures, i);
                if (outcome.skipped()) skippedPassages++;
                else retained.addAll(outcome.matches());
                if ((i + 1) % PROGRESS_EVERY == 0 || i + 1 == futures.size()) {
                    log.info("Confrontati {}/{} passi", i + 1, futures.size());
                }
            }

            store.insertMatches(run.id(), retained);
            store.finalizeRun(run.id(), counts);

            RunReport report = new RunReport(run.id(), metricVersion,
                    counts.passages(), counts.candidates(), skippedPassages, skippedCandidates,
                    retained.size(), Duration.between(started, clock.instant()));
            log.info("Run {} completata: {} match conservati, {} passi e {} candidati saltati, in {} ms",
                    run.id(), retained.size(), skippedPassages, skippedCandidates, report.elapsed().toMillis());
            return report;
        } catch (RuntimeException e) {
            log.error("Run {} interrotta, resta incompleta: {}", run.id(), e.getMessage());
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("metricVersion");
        }
    }

    /** Confronta un passo con tutti i candidati ammessi dal pre-filtro e ne conserva i primi K. */
    PassageOutcome matchPassage(long runId,
                                SourceText passage,
                                List<SourceText> candidates,
                                List<NormalizedStream> candidateStreams,
                                ShingleIndex index,
                                int maxMatches) {
        try {
            NormalizedStream passageStream = GreekNormalizer.normalize(passage.text());
            BitSet admitted = index.candidatesFor(passageStream);

            List<OverlapMatch> matches = new ArrayList<>();
            for (int pos = admitted.nextSetBit(0); pos >= 0; pos = admitted.nextSetBit(pos + 1)) {
                OverlapResult result = OverlapMatcher.match(passageStream, candidateStreams.get(pos));
                if (!thresholds.accepts(result)) continue;
                SourceText candidate = candidates.get(pos);
                matches.add(new OverlapMatch(runId, passage.id(), candidate.id(),
                        candidate.reference(), candidate.label(),
                        result.charLength(), result.charRatio(),
                        result.wordLength(), result.wordRatio(),
                        result.charSpanA(), result.charSpanB(),
                        result.wordSpanA(), result.wordSpanB()));
            }
            return PassageOutcome.of(MatchRanking.topK(matches, maxMatches));
        } catch (RuntimeException e) {
            log.warn("Passo {} ({}) saltato: {}", passage.id(), passage.reference(), e.getMessage());
            return PassageOutcome.SKIPPED;
        }
    }

    private static PassageOutcome await(OverlapRun run, List<CompletableFuture<PassageOutcome>> futures, int i) {
        try {
            return futures.get(i).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RunAbortedException("Run " + run.id() + " interrotta", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new RunAbortedException("Run " + run.id() + ": errore non recuperabile in un worker", e.getCause());
        }
    }

    /** Esito del confronto di un singolo passo. */
    record PassageOutcome(List<OverlapMatch> matches, boolean skipped) {
        static final PassageOutcome SKIPPED = new PassageOutcome(List.of(), true);

        static PassageOutcome of(List<OverlapMatch> matches) {
            return new PassageOutcome(matches, false);
        }
    }
}
