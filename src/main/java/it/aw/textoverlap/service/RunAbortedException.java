package it.aw.textoverlap.service;

/** Passata interrotta prima della finalizzazione; la run resta incompleta. */
public class RunAbortedException extends RuntimeException {

    public RunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
