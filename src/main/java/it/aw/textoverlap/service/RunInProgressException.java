package it.aw.textoverlap.service;

/** Una passata per la stessa versione della metrica è già in corso in questo processo. */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException(String metricVersion) {
        super("passata già in corso per la versione " + metricVersion);
    }
}
