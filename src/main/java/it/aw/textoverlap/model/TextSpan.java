package it.aw.textoverlap.model;

/**
 * Intervallo semiaperto [start, end) di offset carattere nel testo <em>originale</em>
 * (mai in quello normalizzato).
 */
public record TextSpan(int start, int end) {

    public static final TextSpan EMPTY = new TextSpan(0, 0);

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("span non valido: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /** Porzione del testo originale coperta dallo span. */
    public String slice(String original) {
        return original.substring(start, end);
    }
}
