package it.aw.textoverlap.model;

import java.time.Duration;

/**
 * Riepilogo di una passata completata, restituito dall'orchestratore e loggato
 * dal job runner.
 */
public record RunReport(
        long     runId,
        String   metricVersion,
        int      passages,
        int      candidates,
        int      skippedPassages,
        int      skippedCandidates,
        int      retainedMatches,
        Duration elapsed
) {}
