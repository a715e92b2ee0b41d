package it.aw.textoverlap.model;

/**
 * Esito del confronto tra due stream normalizzati A e B.
 * <p>
 * I rapporti sono {@code len / min(lenA, lenB)}, in [0, 1], e valgono 0 se uno dei due
 * stream è vuoto. Gli span indicizzano sempre il testo originale di ciascun lato.
 */
public record OverlapResult(
        int      charLength,
        double   charRatio,
        TextSpan charSpanA,
        TextSpan charSpanB,
        int      wordLength,
        double   wordRatio,
        TextSpan wordSpanA,
        TextSpan wordSpanB
) {
    public static final OverlapResult NONE = new OverlapResult(
            0, 0.0, TextSpan.EMPTY, TextSpan.EMPTY,
            0, 0.0, TextSpan.EMPTY, TextSpan.EMPTY);

    public boolean hasOverlap() {
        return charLength > 0 || wordLength > 0;
    }
}
