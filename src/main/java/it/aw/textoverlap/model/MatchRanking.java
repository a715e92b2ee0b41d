package it.aw.textoverlap.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordinamento dei match di un passo, usato sia in scrittura (taglio top-K) sia
 * nelle letture: rapporto in lettere decrescente, rapporto in parole decrescente,
 * lunghezza in lettere decrescente, infine id del candidato crescente.
 * L'ordine è totale all'interno di un passo.
 */
public final class MatchRanking {

    public static final Comparator<OverlapMatch> ORDER =
            Comparator.comparingDouble(OverlapMatch::charRatio).reversed()
                    .thenComparing(Comparator.comparingDouble(OverlapMatch::wordRatio).reversed())
                    .thenComparing(Comparator.comparingInt(OverlapMatch::charLength).reversed())
                    .thenComparingLong(OverlapMatch::candidateId);

    /** Clausola SQL equivalente a {@link #ORDER}. */
    public static final String SQL_ORDER = "char_ratio DESC, word_ratio DESC, char_len DESC, candidate_id ASC";

    private MatchRanking() {}

    /** I primi {@code k} match secondo {@link #ORDER}. */
    public static List<OverlapMatch> topK(List<OverlapMatch> matches, int k) {
        List<OverlapMatch> sorted = new ArrayList<>(matches);
        sorted.sort(ORDER);
        return sorted.size() <= k ? sorted : new ArrayList<>(sorted.subList(0, k));
    }
}
