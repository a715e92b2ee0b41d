package it.aw.textoverlap.model;

import java.time.LocalDateTime;

/**
 * Una passata di calcolo delle sovrapposizioni.
 * <p>
 * {@code finishedAt} è null finché la passata è in corso, o se è stata interrotta:
 * in entrambi i casi la run non è mai restituita dalle query "ultima run completata".
 */
public record OverlapRun(
        long          id,
        String        metricVersion,
        LocalDateTime createdAt,
        LocalDateTime finishedAt,     // null = in corso o abortita
        int           passageCount,   // dimensione del corpus dei passi al momento della run
        int           candidateCount  // dimensione del corpus dei candidati al momento della run
) {
    public boolean isCompleted() {
        return finishedAt != null;
    }
}
