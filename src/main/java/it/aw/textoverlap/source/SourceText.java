package it.aw.textoverlap.source;

/**
 * Un testo di un corpus, così come letto dalla sorgente.
 * <p>
 * Per i passi {@code reference} è il riferimento umano (es. "12.3") e {@code label}
 * l'etichetta breve; per i candidati {@code reference} è l'identificativo esterno
 * stabile e {@code label} il lemma da mostrare.
 */
public record SourceText(
        long   id,
        String reference,   // opzionale
        String label,       // opzionale
        String text
) {}
