package it.aw.textoverlap.registry;

/** Store delle sovrapposizioni non disponibile in lettura o scrittura: errore fatale. */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
