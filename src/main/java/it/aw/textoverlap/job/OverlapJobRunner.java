package it.aw.textoverlap.job;

import it.aw.textoverlap.model.RunParams;
import it.aw.textoverlap.model.RunReport;
import it.aw.textoverlap.service.OverlapOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Esegue una passata all'avvio dell'applicazione, per l'uso da cron:
 * <pre>
 *   java -jar textoverlap.jar --spring.main.web-application-type=none \
 *        --overlap.job.enabled=true --overlap.metric-version=v1 --overlap.max-matches=10
 * </pre>
 * I due parametri della passata sono letti qui e passati esplicitamente
 * all'orchestratore. Se la passata fallisce l'eccezione risale e il processo
 * termina con codice diverso da zero.
 */
@Component
@ConditionalOnProperty(name = "overlap.job.enabled", havingValue = "true")
public class OverlapJobRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OverlapJobRunner.class);

    private final OverlapOrchestrator orchestrator;
    private final String metricVersion;
    private final int maxMatches;

    public OverlapJobRunner(OverlapOrchestrator orchestrator,
                            @Value("${overlap.metric-version:" + RunParams.DEFAULT_METRIC_VERSION + "}") String metricVersion,
                            @Value("${overlap.max-matches:" + RunParams.DEFAULT_MAX_MATCHES + "}") int maxMatches) {
        this.orchestrator = orchestrator;
        this.metricVersion = metricVersion;
        this.maxMatches = maxMatches;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunParams params = new RunParams(metricVersion, maxMatches);
        log.info("Calcolo sovrapposizioni ({}), max {} match per passo", params.metricVersion(),
                params.maxMatchesPerPassage());
        try {
            RunReport report = orchestrator.run(params);
            log.info("OK: run {} completata ({} match)", report.runId(), report.retainedMatches());
        } catch (RuntimeException e) {
            log.error("Calcolo sovrapposizioni fallito ({})", params.metricVersion(), e);
            throw e;
        }
    }
}
