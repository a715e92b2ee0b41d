package it.aw.textoverlap.controller;

import it.aw.textoverlap.model.OverlapMatch;
import it.aw.textoverlap.model.OverlapRun;
import it.aw.textoverlap.model.RunParams;
import it.aw.textoverlap.registry.OverlapStore;
import it.aw.textoverlap.registry.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Espone in sola lettura le run e i match calcolati. Nessun endpoint avvia un calcolo:
 * le passate sono eseguite dal job (vedi {@code OverlapJobRunner}).
 *
 * Endpoint disponibili:
 *   GET /api/overlaps/runs?metricVersion=                  — tutte le run, anche incomplete
 *   GET /api/overlaps/runs/latest?metricVersion=           — ultima run completata
 *   GET /api/overlaps/passages/{id}/matches?metricVersion= — match di un passo
 *   GET /api/overlaps/candidates/{id}/matches?metricVersion= — match di un candidato
 *
 * Se {@code metricVersion} è omesso si usa {@code overlap.metric-version}.
 * Gli span sono offset 0-based, fine esclusa, nel testo originale di ciascun lato.
 */
@RestController
@RequestMapping("/api/overlaps")
public class OverlapController {

    private static final Logger log = LoggerFactory.getLogger(OverlapController.class);

    private final OverlapStore store;
    private final String defaultMetricVersion;

    public OverlapController(OverlapStore store,
                             @Value("${overlap.metric-version:" + RunParams.DEFAULT_METRIC_VERSION + "}")
                             String defaultMetricVersion) {
        this.store = store;
        this.defaultMetricVersion = defaultMetricVersion;
    }

    // -------------------------------------------------------------------------
    // GET /api/overlaps/runs
    // -------------------------------------------------------------------------

    /**
     * Storico delle run di una versione, dalla più recente. Include le run
     * incomplete, riconoscibili da {@code finishedAt} null.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/overlaps/runs?metricVersion=v1"
     */
    @GetMapping("/runs")
    public ResponseEntity<List<OverlapRun>> listRuns(
            @RequestParam(value = "metricVersion", required = false) String metricVersion) {
        return ResponseEntity.ok(store.findRuns(versionOrDefault(metricVersion)));
    }

    // -------------------------------------------------------------------------
    // GET /api/overlaps/runs/latest
    // -------------------------------------------------------------------------

    /**
     * Ultima run completata. 404 se la versione non ha ancora run completate.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/overlaps/runs/latest"
     */
    @GetMapping("/runs/latest")
    public ResponseEntity<OverlapRun> latestRun(
            @RequestParam(value = "metricVersion", required = false) String metricVersion) {
        return store.findLatestCompletedRun(versionOrDefault(metricVersion))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // GET /api/overlaps/passages/{passageId}/matches
    // -------------------------------------------------------------------------

    /**
     * Match di un passo nell'ultima run completata, nell'ordine di classifica.
     * Lista vuota se il passo non ha match (o se non esistono run completate).
     *
     * Esempio:
     *   curl "http://localhost:8889/api/overlaps/passages/42/matches?metricVersion=v1"
     */
    @GetMapping("/passages/{passageId}/matches")
    public ResponseEntity<List<OverlapMatch>> passageMatches(
            @PathVariable long passageId,
            @RequestParam(value = "metricVersion", required = false) String metricVersion) {
        return ResponseEntity.ok(store.findLatestMatchesByPassage(versionOrDefault(metricVersion), passageId));
    }

    // -------------------------------------------------------------------------
    // GET /api/overlaps/candidates/{candidateId}/matches
    // -------------------------------------------------------------------------

    /**
     * Match di un candidato nell'ultima run completata.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/overlaps/candidates/1234/matches"
     */
    @GetMapping("/candidates/{candidateId}/matches")
    public ResponseEntity<List<OverlapMatch>> candidateMatches(
            @PathVariable long candidateId,
            @RequestParam(value = "metricVersion", required = false) String metricVersion) {
        return ResponseEntity.ok(store.findLatestMatchesByCandidate(versionOrDefault(metricVersion), candidateId));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Void> storeUnavailable(StoreUnavailableException e) {
        log.error("Store non disponibile: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    private String versionOrDefault(String metricVersion) {
        return metricVersion == null || metricVersion.isBlank() ? defaultMetricVersion : metricVersion.strip();
    }
}
