package it.aw.textoverlap.service;

import it.aw.textoverlap.model.NormalizedStream;
import it.aw.textoverlap.model.OverlapResult;
import it.aw.textoverlap.model.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OverlapMatcherTest {

    private static OverlapResult match(String a, String b) {
        return OverlapMatcher.match(GreekNormalizer.normalize(a), GreekNormalizer.normalize(b));
    }

    @Test
    void match_accentsAndFinalSigmaShouldNotBreakTheBlock() {
        String passage = "τὸν λόγον";
        String candidate = "τὸνλογοσ";

        OverlapResult r = match(passage, candidate);

        assertThat(r.charLength()).isEqualTo(7);
        assertThat(r.charRatio()).isCloseTo(0.875, within(1e-9));
        assertThat(r.charSpanA()).isEqualTo(new TextSpan(0, 8));
        assertThat(r.charSpanB()).isEqualTo(new TextSpan(0, 7));
        assertThat(GreekNormalizer.letters(r.charSpanA().slice(passage))).isEqualTo("τονλογο");

        // nessuna parola in comune: "τον","λογον" contro "τονλογοσ"
        assertThat(r.wordLength()).isZero();
        assertThat(r.wordRatio()).isZero();
        assertThat(r.wordSpanA()).isEqualTo(TextSpan.EMPTY);
    }

    @Test
    void match_emptyStreamShouldYieldZeroes() {
        OverlapResult r = match("12, 13 - p. 4", "λόγος");

        assertThat(r.charLength()).isZero();
        assertThat(r.charRatio()).isZero();
        assertThat(r.wordLength()).isZero();
        assertThat(r.wordRatio()).isZero();
        assertThat(r.charSpanA().isEmpty()).isTrue();
        assertThat(r.charSpanB().isEmpty()).isTrue();
        assertThat(r.hasOverlap()).isFalse();
    }

    @Test
    void match_nothingInCommonShouldYieldEmptySpans() {
        OverlapResult r = match("αβγ", "δεζ");

        assertThat(r.charLength()).isZero();
        assertThat(r.charSpanA()).isEqualTo(TextSpan.EMPTY);
        assertThat(r.charSpanB()).isEqualTo(TextSpan.EMPTY);
    }

    @Test
    void match_tieShouldPreferEarliestStartInA() {
        // "αβ" e "γδ" hanno la stessa lunghezza: vince "αβ", che in A inizia prima
        OverlapResult r = match("αβ γδ", "γδ αβ");

        assertThat(r.charLength()).isEqualTo(2);
        assertThat(r.charSpanA()).isEqualTo(new TextSpan(0, 2));
        assertThat(r.charSpanB()).isEqualTo(new TextSpan(3, 5));
        assertThat(r.wordLength()).isEqualTo(1);
        assertThat(r.wordSpanA()).isEqualTo(new TextSpan(0, 2));
        assertThat(r.wordSpanB()).isEqualTo(new TextSpan(3, 5));
    }

    @Test
    void match_tieShouldPreferEarliestStartInBForTheSameStartInA() {
        OverlapResult r = match("αβ", "αβ αβ");

        assertThat(r.charSpanB()).isEqualTo(new TextSpan(0, 2));
        assertThat(r.wordSpanB()).isEqualTo(new TextSpan(0, 2));
    }

    @Test
    void match_shouldFindLongestCommonWordRun() {
        String a = "ὁ ἀνὴρ λέγει τὸν λόγον καλῶς";
        String b = "καὶ τὸν λόγον καλῶς εἶπεν";

        OverlapResult r = match(a, b);

        assertThat(r.wordLength()).isEqualTo(3);
        assertThat(r.wordRatio()).isCloseTo(0.6, within(1e-9));
        assertThat(r.wordSpanA().slice(a)).isEqualTo("τὸν λόγον καλῶς");
        assertThat(r.wordSpanB().slice(b)).isEqualTo("τὸν λόγον καλῶς");

        // in lettere il blocco si estende alla iota finale di λέγει / καὶ
        assertThat(r.charLength()).isEqualTo(14);
        assertThat(GreekNormalizer.letters(r.charSpanA().slice(a))).isEqualTo("ιτονλογονκαλωσ");
        assertThat(GreekNormalizer.letters(r.charSpanB().slice(b))).isEqualTo("ιτονλογονκαλωσ");
    }

    @Test
    void match_ratioShouldUseTheShorterStream() {
        OverlapResult r = match("λόγος", "ὁ λόγος τοῦ θεοῦ");

        assertThat(r.charLength()).isEqualTo(5);
        assertThat(r.charRatio()).isEqualTo(1.0);
        assertThat(r.wordRatio()).isEqualTo(1.0);
    }

    @Test
    void ratio_zeroLengthStreamShouldGiveZero() {
        assertThat(OverlapMatcher.ratio(0, 0, 10)).isZero();
        assertThat(OverlapMatcher.ratio(3, 4, 6)).isEqualTo(0.75);
    }

    @Test
    void match_randomTextsShouldKeepSpansInBoundsAndConsistent() {
        Random random = new Random(42);
        for (int round = 0; round < 300; round++) {
            String a = randomGreek(random, 1 + random.nextInt(40));
            String b = randomGreek(random, 1 + random.nextInt(40));
            NormalizedStream sa = GreekNormalizer.normalize(a);
            NormalizedStream sb = GreekNormalizer.normalize(b);

            OverlapResult r = OverlapMatcher.match(sa, sb);

            assertThat(r.charLength()).isBetween(0, Math.min(sa.letterCount(), sb.letterCount()));
            assertThat(r.wordLength()).isBetween(0, Math.min(sa.wordCount(), sb.wordCount()));
            assertThat(r.charRatio()).isBetween(0.0, 1.0);
            assertThat(r.wordRatio()).isBetween(0.0, 1.0);
            assertThat(r.charSpanA().end()).isLessThanOrEqualTo(a.length());
            assertThat(r.charSpanB().end()).isLessThanOrEqualTo(b.length());
            assertThat(r.wordSpanA().end()).isLessThanOrEqualTo(a.length());
            assertThat(r.wordSpanB().end()).isLessThanOrEqualTo(b.length());

            String lettersA = GreekNormalizer.letters(r.charSpanA().slice(a));
            assertThat(lettersA).hasSize(r.charLength());
            assertThat(GreekNormalizer.letters(r.charSpanB().slice(b))).isEqualTo(lettersA);
            assertThat(r.charLength()).isEqualTo(bruteForceLongest(sa.letters(), sb.letters()));

            var wordsA = GreekNormalizer.words(r.wordSpanA().slice(a));
            assertThat(wordsA).hasSize(r.wordLength());
            assertThat(GreekNormalizer.words(r.wordSpanB().slice(b))).isEqualTo(wordsA);
        }
    }

    @Test
    void match_shouldBeDeterministic() {
        String a = "Ἄβαι, πόλις Φωκίδος· ὁ πολίτης Ἀβαῖος";
        String b = "ἀπὸ τῆς πόλεως Ἀβαί· ὁ πολίτης Ἀβαῖος καὶ Ἀβαεύς";

        assertThat(match(a, b)).isEqualTo(match(a, b));
    }

    private static final String[] PIECES = {"α", "β", "ά", "ὁ", "ς", "σ", "ι", "ῳ", " ", " ", ", ", "\u0301"};

    private static String randomGreek(Random random, int pieces) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pieces; i++) {
            sb.append(PIECES[random.nextInt(PIECES.length)]);
        }
        return sb.toString();
    }

    private static int bruteForceLongest(String a, String b) {
        int best = 0;
        for (int i = 0; i < a.length(); i++) {
            for (int j = 0; j < b.length(); j++) {
                int k = 0;
                while (i + k < a.length() && j + k < b.length() && a.charAt(i + k) == b.charAt(j + k)) k++;
                best = Math.max(best, k);
            }
        }
        return best;
    }
}
