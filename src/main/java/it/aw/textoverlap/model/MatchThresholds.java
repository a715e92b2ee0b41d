package it.aw.textoverlap.model;

/**
 * Soglie minime per conservare una coppia: la coppia resta se la sovrapposizione
 * in lettere raggiunge {@code minCharLength} <em>oppure</em> quella in parole
 * raggiunge {@code minWordLength}.
 * <p>
 * Con entrambe le soglie a 0 ogni coppia è conservata, anche senza sovrapposizione.
 */
public record MatchThresholds(int minCharLength, int minWordLength) {

    public static final int DEFAULT_MIN_CHAR_LENGTH = 30;
    public static final int DEFAULT_MIN_WORD_LENGTH = 4;

    public MatchThresholds {
        if (minCharLength < 0 || minWordLength < 0) {
            throw new IllegalArgumentException(
                    "soglie negative non ammesse: char=" + minCharLength + ", word=" + minWordLength);
        }
    }

    public static MatchThresholds defaults() {
        return new MatchThresholds(DEFAULT_MIN_CHAR_LENGTH, DEFAULT_MIN_WORD_LENGTH);
    }

    public static MatchThresholds none() {
        return new MatchThresholds(0, 0);
    }

    /** Vero se nessuna coppia può essere scartata dalle soglie. */
    public boolean acceptsEverything() {
        return minCharLength == 0 || minWordLength == 0;
    }

    public boolean accepts(OverlapResult result) {
        return result.charLength() >= minCharLength || result.wordLength() >= minWordLength;
    }
}
