package it.aw.textoverlap.service;

import it.aw.textoverlap.model.MatchThresholds;
import it.aw.textoverlap.model.NormalizedStream;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-filtro esatto dei candidati, costruito una volta per passata.
 * <p>
 * Indice invertito degli shingle dei candidati: k-grammi di lettere con
 * k = {@code minCharLength} e sequenze di w parole con w = {@code minWordLength}.
 * Una coppia può superare le soglie solo se condivide almeno uno di questi shingle:
 * un blocco comune di almeno k lettere contiene un k-gramma comune, e lo stesso
 * vale per le parole. Il filtro quindi non produce mai falsi negativi; le collisioni
 * di hash danno solo falsi positivi, poi scartati dal matcher.
 * <p>
 * Immutabile dopo la costruzione: condivisibile in sola lettura tra i worker.
 */
public final class ShingleIndex {

    private static final char WORD_SEPARATOR = ' ';

    private final MatchThresholds thresholds;
    private final int size;
    private final Map<Integer, int[]> charPostings;
    private final Map<Integer, int[]> wordPostings;

    private ShingleIndex(MatchThresholds thresholds, int size,
                         Map<Integer, int[]> charPostings, Map<Integer, int[]> wordPostings) {
        this.thresholds = thresholds;
        this.size = size;
        this.charPostings = charPostings;
        this.wordPostings = wordPostings;
    }

    /**
     * Costruisce l'indice sui candidati, nell'ordine dato: le posizioni restituite da
     * {@link #candidatesFor(NormalizedStream)} sono indici in questa lista.
     */
    public static ShingleIndex build(List<NormalizedStream> candidates, MatchThresholds thresholds) {
        if (thresholds.acceptsEverything()) {
            return new ShingleIndex(thresholds, candidates.size(), Map.of(), Map.of());
        }
        Map<Integer, List<Integer>> chars = new HashMap<>();
        Map<Integer, List<Integer>> words = new HashMap<>();
        for (int pos = 0; pos < candidates.size(); pos++) {
            NormalizedStream stream = candidates.get(pos);
            for (int h : charShingles(stream.letters(), thresholds.minCharLength())) {
                chars.computeIfAbsent(h, x -> new ArrayList<>()).add(pos);
            }
            for (int h : wordShingles(stream.words(), thresholds.minWordLength())) {
                words.computeIfAbsent(h, x -> new ArrayList<>()).add(pos);
            }
        }
        return new ShingleIndex(thresholds, candidates.size(), freeze(chars), freeze(words));
    }

    /** Posizioni dei candidati che possono superare le soglie contro il passo dato. */
    public BitSet candidatesFor(NormalizedStream passage) {
        BitSet hits = new BitSet(size);
        if (thresholds.acceptsEverything()) {
            hits.set(0, size);
            return hits;
        }
        for (int h : charShingles(passage.letters(), thresholds.minCharLength())) {
            mark(hits, charPostings.get(h));
        }
        for (int h : wordShingles(passage.words(), thresholds.minWordLength())) {
            mark(hits, wordPostings.get(h));
        }
        return hits;
    }

    public int size() {
        return size;
    }

    static Set<Integer> charShingles(String letters, int k) {
        Set<Integer> out = new HashSet<>();
        if (k <= 0 || letters.length() < k) return out;
        for (int i = 0; i + k <= letters.length(); i++) {
            out.add(letters.substring(i, i + k).hashCode());
        }
        return out;
    }

    static Set<Integer> wordShingles(List<String> words, int w) {
        Set<Integer> out = new HashSet<>();
        if (w <= 0 || words.size() < w) return out;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i + w <= words.size(); i++) {
            sb.setLength(0);
            for (int t = i; t < i + w; t++) {
                if (t > i) sb.append(WORD_SEPARATOR);
                sb.append(words.get(t));
            }
            out.add(sb.toString().hashCode());
        }
        return out;
    }

    private static void mark(BitSet hits, int[] postings) {
        if (postings == null) return;
        for (int pos : postings) hits.set(pos);
    }

    private static Map<Integer, int[]> freeze(Map<Integer, List<Integer>> postings) {
        Map<Integer, int[]> frozen = new HashMap<>(postings.size() * 2);
        postings.forEach((h, list) -> frozen.put(h, list.stream().mapToInt(Integer::intValue).toArray()));
        return frozen;
    }
}
