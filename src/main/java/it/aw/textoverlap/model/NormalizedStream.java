package it.aw.textoverlap.model;

import java.util.Arrays;
import java.util.List;

/**
 * Risultato della normalizzazione di un testo: stream di lettere e stream di parole,
 * entrambi con la mappa di ritorno verso gli offset del testo originale.
 * <p>
 * Per ogni lettera {@code i} dello stream, {@code letterStart(i)} è l'indice nel testo
 * originale del carattere da cui deriva e {@code letterEnd(i)} l'indice subito dopo
 * (segni combinanti in coda inclusi). Entrambe le mappe sono monotone non decrescenti.
 * <p>
 * Derivato, mai persistito. Le istanze sono immutabili e condivisibili tra thread.
 */
public final class NormalizedStream {

    private final String original;
    private final String letters;
    private final int[] letterStarts;
    private final int[] letterEnds;
    private final List<String> words;
    private final int[] wordStarts;
    private final int[] wordEnds;

    public NormalizedStream(String original,
                            String letters,
                            int[] letterStarts,
                            int[] letterEnds,
                            List<String> words,
                            int[] wordStarts,
                            int[] wordEnds) {
        if (letters.length() != letterStarts.length || letterStarts.length != letterEnds.length) {
            throw new IllegalArgumentException("mappa lettere incoerente con lo stream");
        }
        if (words.size() != wordStarts.length || wordStarts.length != wordEnds.length) {
            throw new IllegalArgumentException("mappa parole incoerente con lo stream");
        }
        this.original = original;
        this.letters = letters;
        this.letterStarts = letterStarts.clone();
        this.letterEnds = letterEnds.clone();
        this.words = List.copyOf(words);
        this.wordStarts = wordStarts.clone();
        this.wordEnds = wordEnds.clone();
    }

    public String original()  { return original; }
    public String letters()   { return letters; }
    public List<String> words() { return words; }

    public int letterCount()  { return letters.length(); }
    public int wordCount()    { return words.size(); }

    public boolean isEmpty() {
        return letters.isEmpty();
    }

    public int letterStart(int i) { return letterStarts[i]; }
    public int letterEnd(int i)   { return letterEnds[i]; }
    public int wordStart(int i)   { return wordStarts[i]; }
    public int wordEnd(int i)     { return wordEnds[i]; }

    /** Span originale delle lettere normalizzate [from, to). */
    public TextSpan letterSpan(int from, int to) {
        if (from >= to) return TextSpan.EMPTY;
        return new TextSpan(letterStarts[from], letterEnds[to - 1]);
    }

    /** Unione degli span originali dei token [from, to). */
    public TextSpan wordSpan(int from, int to) {
        if (from >= to) return TextSpan.EMPTY;
        return new TextSpan(wordStarts[from], wordEnds[to - 1]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedStream other)) return false;
        return original.equals(other.original)
                && letters.equals(other.letters)
                && Arrays.equals(letterStarts, other.letterStarts)
                && Arrays.equals(letterEnds, other.letterEnds)
                && words.equals(other.words)
                && Arrays.equals(wordStarts, other.wordStarts)
                && Arrays.equals(wordEnds, other.wordEnds);
    }

    @Override
    public int hashCode() {
        return 31 * original.hashCode() + letters.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizedStream[letters=" + letters + ", words=" + words + "]";
    }
}
