package it.aw.textoverlap.model;

/**
 * Parametri di una singola passata: versione della metrica e numero massimo
 * di match conservati per passo.
 * <p>
 * Sono gli unici due parametri esposti verso l'esterno; vengono passati esplicitamente
 * all'orchestratore all'avvio della passata.
 */
public record RunParams(String metricVersion, int maxMatchesPerPassage) {

    public static final String DEFAULT_METRIC_VERSION = "v1";
    public static final int    DEFAULT_MAX_MATCHES    = 10;

    /** Costruttore compatto con validazione. */
    public RunParams {
        if (metricVersion == null || metricVersion.isBlank()) {
            throw new IllegalArgumentException("metricVersion obbligatoria");
        }
        if (maxMatchesPerPassage < 1) {
            throw new IllegalArgumentException(
                    "maxMatchesPerPassage deve essere >= 1 (ricevuto: " + maxMatchesPerPassage + ")");
        }
        metricVersion = metricVersion.strip();
    }

    public static RunParams defaults() {
        return new RunParams(DEFAULT_METRIC_VERSION, DEFAULT_MAX_MATCHES);
    }
}
