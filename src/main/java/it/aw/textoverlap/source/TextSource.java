package it.aw.textoverlap.source;

import java.util.List;

/**
 * Sorgente di testi in sola lettura. Passi e candidati vivono in sistemi distinti,
 * con proprietari distinti: ognuno ha la propria implementazione e non esistono
 * query congiunte tra le due.
 */
public interface TextSource {

    /** Nome della sorgente, per log e messaggi d'errore. */
    String name();

    /**
     * Legge l'intero corpus in un unico istante.
     *
     * @throws SourceUnavailableException se la sorgente non è raggiungibile o leggibile
     */
    List<SourceText> fetchAll();
}
