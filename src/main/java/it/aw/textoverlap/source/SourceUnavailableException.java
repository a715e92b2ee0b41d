package it.aw.textoverlap.source;

/** Corpus non leggibile: errore fatale per la passata in corso. */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
