package it.aw.textoverlap.service;

import it.aw.textoverlap.model.NormalizedStream;
import it.aw.textoverlap.model.OverlapResult;
import it.aw.textoverlap.model.TextSpan;

import java.util.List;

/**
 * Trova il più lungo blocco contiguo comune tra due stream normalizzati,
 * sia a livello di lettere sia a livello di parole, e lo riporta agli
 * offset dei testi originali.
 * <p>
 * Programmazione dinamica classica con due sole righe della tabella:
 * tempo O(|A|·|B|), memoria O(|B|).
 * <p>
 * A parità di lunghezza vince il blocco che inizia prima in A e, a parità,
 * quello che inizia prima in B. Il risultato è quindi deterministico.
 */
public final class OverlapMatcher {

    private OverlapMatcher() {}

    /**
     * Confronta due stream normalizzati.
     * Se uno dei due è vuoto restituisce lunghezze e rapporti a zero e span vuoti.
     */
    public static OverlapResult match(NormalizedStream a, NormalizedStream b) {
        Block chars = longestCommonLetters(a.letters(), b.letters());
        Block words = longestCommonWords(a.words(), b.words());

        TextSpan charSpanA = a.letterSpan(chars.startA(), chars.startA() + chars.length());
        TextSpan charSpanB = b.letterSpan(chars.startB(), chars.startB() + chars.length());
        TextSpan wordSpanA = a.wordSpan(words.startA(), words.startA() + words.length());
        TextSpan wordSpanB = b.wordSpan(words.startB(), words.startB() + words.length());

        return new OverlapResult(
                chars.length(), ratio(chars.length(), a.letterCount(), b.letterCount()), charSpanA, charSpanB,
                words.length(), ratio(words.length(), a.wordCount(), b.wordCount()), wordSpanA, wordSpanB);
    }

    /** Lunghezza del blocco normalizzata sullo stream più corto; 0 se uno dei due è vuoto. */
    static double ratio(int length, int lenA, int lenB) {
        int shorter = Math.min(lenA, lenB);
        if (shorter == 0) return 0.0;
        return (double) length / shorter;
    }

    /** Blocco comune: inizio in A, inizio in B, lunghezza. */
    record Block(int startA, int startB, int length) {
        static final Block NONE = new Block(0, 0, 0);
    }

    static Block longestCommonLetters(String a, String b) {
        int n = a.length();
        int m = b.length();
        if (n == 0 || m == 0) return Block.NONE;

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        int bestLen = 0;
        int bestEndA = 0;
        int bestEndB = 0;

        for (int i = 1; i <= n; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                if (ca == b.charAt(j - 1)) {
                    int len = prev[j - 1] + 1;
                    curr[j] = len;
                    // stretto: un blocco di pari lunghezza trovato dopo inizia più avanti in A (o in B)
                    if (len > bestLen) {
                        bestLen = len;
                        bestEndA = i;
                        bestEndB = j;
                    }
                } else {
                    curr[j] = 0;
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        if (bestLen == 0) return Block.NONE;
        return new Block(bestEndA - bestLen, bestEndB - bestLen, bestLen);
    }

    static Block longestCommonWords(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        if (n == 0 || m == 0) return Block.NONE;

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        int bestLen = 0;
        int bestEndA = 0;
        int bestEndB = 0;

        for (int i = 1; i <= n; i++) {
            String wa = a.get(i - 1);
            for (int j = 1; j <= m; j++) {
                if (wa.equals(b.get(j - 1))) {
                    int len = prev[j - 1] + 1;
                    curr[j] = len;
                    if (len > bestLen) {
                        bestLen = len;
                        bestEndA = i;
                        bestEndB = j;
                    }
                } else {
                    curr[j] = 0;
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        if (bestLen == 0) return Block.NONE;
        return new Block(bestEndA - bestLen, bestEndB - bestLen, bestLen);
    }
}
