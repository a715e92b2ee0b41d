package it.aw.textoverlap.model;

/**
 * Sovrapposizione conservata per una coppia (passo, candidato) all'interno di una run.
 * <p>
 * Gli span sono offset 0-based, fine esclusa, nel testo <em>originale</em> del passo
 * e del candidato rispettivamente. {@code passageSpan}/{@code candidateSpan} coprono
 * il blocco in lettere ({@code charLength}); {@code passageWordSpan}/{@code candidateWordSpan}
 * la sequenza di parole ({@code wordLength}), vuoti se nessuna parola è in comune.
 */
public record OverlapMatch(
        long     runId,
        long     passageId,
        long     candidateId,
        String   candidateReference,  // riferimento esterno stabile del candidato, opzionale
        String   candidateLabel,      // etichetta per la UI, opzionale
        int      charLength,
        double   charRatio,
        int      wordLength,
        double   wordRatio,
        TextSpan passageSpan,
        TextSpan candidateSpan,
        TextSpan passageWordSpan,
        TextSpan candidateWordSpan
) {}
