package it.aw.textoverlap.model;

/** Dimensioni dei due corpora lette all'inizio di una passata. */
public record CorpusCounts(int passages, int candidates) {

    public CorpusCounts {
        if (passages < 0 || candidates < 0) {
            throw new IllegalArgumentException("conteggi negativi: " + passages + "/" + candidates);
        }
    }
}
