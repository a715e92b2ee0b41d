package it.aw.textoverlap.service;

import it.aw.textoverlap.model.NormalizedStream;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizza un testo greco per il confronto, conservando la mappa verso gli offset
 * del testo originale.
 * <p>
 * Passi, nell'ordine:
 * <ol>
 *   <li>decomposizione canonica (NFD), così lettere base e segni combinanti si separano</li>
 *   <li>rimozione dei segni combinanti (accenti, spiriti, iota sottoscritto, dieresi)</li>
 *   <li>minuscolo</li>
 *   <li>sigma finale {@code ς} ricondotto a {@code σ}</li>
 *   <li>stream di lettere: solo le lettere greche, ognuna con l'offset del carattere originale</li>
 *   <li>stream di parole: sequenze massimali di lettere greche, ognuna con il suo span originale</li>
 * </ol>
 * La decomposizione avviene per singolo code point: l'ordinamento canonico dei segni
 * combinanti non conta, perché i segni vengono comunque scartati. Un segno combinante
 * è trasparente: non interrompe una parola ed estende lo span della lettera che lo precede.
 * <p>
 * Funzione pura e deterministica: stesso input, stesso output.
 */
public final class GreekNormalizer {

    private static final char FINAL_SIGMA = 'ς';
    private static final char SIGMA       = 'σ';

    private GreekNormalizer() {}

    /**
     * Normalizza il testo producendo entrambi gli stream.
     *
     * @param text testo originale, anche privo di lettere greche
     * @return stream normalizzato; vuoto (non errore) se il testo non contiene lettere greche
     * @throws IllegalArgumentException se {@code text} è null
     */
    public static NormalizedStream normalize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("testo nullo: impossibile normalizzare");
        }
        StringBuilder letters = new StringBuilder(text.length());
        List<Integer> letterStarts = new ArrayList<>();
        List<Integer> letterEnds = new ArrayList<>();

        List<String> words = new ArrayList<>();
        List<Integer> wordStarts = new ArrayList<>();
        List<Integer> wordEnds = new ArrayList<>();

        StringBuilder token = new StringBuilder();
        int tokenStart = -1;
        int tokenEnd = -1;
        boolean afterLetter = false;

        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            String decomposed = Normalizer.normalize(new String(Character.toChars(cp)), Normalizer.Form.NFD);

            for (int k = 0; k < decomposed.length(); ) {
                int d = decomposed.codePointAt(k);
                k += Character.charCount(d);

                if (isCombiningMark(d)) {
                    // segno staccato nel testo originale: allarga la lettera precedente
                    if (afterLetter && letterEnds.get(letterEnds.size() - 1) < next) {
                        letterEnds.set(letterEnds.size() - 1, next);
                        tokenEnd = next;
                    }
                    continue;
                }

                int folded = fold(d);
                if (isGreekLetter(folded)) {
                    letters.appendCodePoint(folded);
                    letterStarts.add(i);
                    letterEnds.add(next);
                    if (tokenStart < 0) tokenStart = i;
                    token.appendCodePoint(folded);
                    tokenEnd = next;
                    afterLetter = true;
                } else {
                    if (tokenStart >= 0) {
                        words.add(token.toString());
                        wordStarts.add(tokenStart);
                        wordEnds.add(tokenEnd);
                        token.setLength(0);
                        tokenStart = -1;
                    }
                    afterLetter = false;
                }
            }
            i = next;
        }
        if (tokenStart >= 0) {
            words.add(token.toString());
            wordStarts.add(tokenStart);
            wordEnds.add(tokenEnd);
        }

        return new NormalizedStream(text, letters.toString(),
                toArray(letterStarts), toArray(letterEnds),
                words, toArray(wordStarts), toArray(wordEnds));
    }

    /** Solo lo stream di lettere normalizzate. */
    public static String letters(String text) {
        return normalize(text).letters();
    }

    /** Solo lo stream di parole normalizzate. */
    public static List<String> words(String text) {
        return normalize(text).words();
    }

    /** Minuscolo + sigma finale. */
    private static int fold(int cp) {
        int lower = Character.toLowerCase(cp);
        return lower == FINAL_SIGMA ? SIGMA : lower;
    }

    static boolean isGreekLetter(int cp) {
        boolean greekBlock = (cp >= 0x0370 && cp <= 0x03FF) || (cp >= 0x1F00 && cp <= 0x1FFF);
        return greekBlock && Character.isLetter(cp);
    }

    static boolean isCombiningMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
