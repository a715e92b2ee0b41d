package it.aw.textoverlap.service;

import it.aw.textoverlap.model.NormalizedStream;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GreekNormalizerTest {

    @Test
    void normalize_shouldStripAccentsBreathingsAndCase() {
        NormalizedStream s = GreekNormalizer.normalize("Ἀθῆναι· πόλις");

        assertThat(s.letters()).isEqualTo("αθηναιπολισ");
        assertThat(s.words()).containsExactly("αθηναι", "πολισ");
    }

    @Test
    void normalize_shouldFoldFinalSigma() {
        assertThat(GreekNormalizer.letters("λόγος")).isEqualTo("λογοσ");
        assertThat(GreekNormalizer.letters("ΛΟΓΟΣ")).isEqualTo("λογοσ");
    }

    @Test
    void normalize_shouldDropIotaSubscript() {
        // ᾳ = α + ypogegrammeni combinante
        assertThat(GreekNormalizer.letters("τῇ ᾠδῇ")).isEqualTo("τηωδη");
    }

    @Test
    void normalize_shouldMapEveryLetterToItsOriginalCharacter() {
        String original = "τὸν λόγον";
        NormalizedStream s = GreekNormalizer.normalize(original);

        assertThat(s.letters()).isEqualTo("τονλογον");
        for (int i = 0; i < s.letterCount(); i++) {
            String source = original.substring(s.letterStart(i), s.letterEnd(i));
            assertThat(GreekNormalizer.letters(source)).isEqualTo(String.valueOf(s.letters().charAt(i)));
        }
        // lo spazio (indice 3) non compare nella mappa
        assertThat(s.letterStart(2)).isEqualTo(2);
        assertThat(s.letterStart(3)).isEqualTo(4);
    }

    @Test
    void normalize_offsetMapsShouldBeMonotonic() {
        NormalizedStream s = GreekNormalizer.normalize("Μῆνιν ἄειδε, θεά, Πηληϊάδεω Ἀχιλῆος");

        for (int i = 1; i < s.letterCount(); i++) {
            assertThat(s.letterStart(i)).isGreaterThanOrEqualTo(s.letterStart(i - 1));
            assertThat(s.letterEnd(i)).isGreaterThanOrEqualTo(s.letterEnd(i - 1));
        }
        for (int i = 1; i < s.wordCount(); i++) {
            assertThat(s.wordStart(i)).isGreaterThanOrEqualTo(s.wordEnd(i - 1));
        }
    }

    @Test
    void normalize_shouldRecordWordSpansInOriginalText() {
        String original = "Ἀθῆναι· πόλις";
        NormalizedStream s = GreekNormalizer.normalize(original);

        assertThat(original.substring(s.wordStart(0), s.wordEnd(0))).isEqualTo("Ἀθῆναι");
        assertThat(original.substring(s.wordStart(1), s.wordEnd(1))).isEqualTo("πόλις");
    }

    @Test
    void normalize_decomposedMarksShouldNotSplitWordsAndExtendTheLetterSpan() {
        String original = "λο\u0301γος";   // accento acuto come carattere separato
        NormalizedStream s = GreekNormalizer.normalize(original);

        assertThat(s.letters()).isEqualTo("λογοσ");
        assertThat(s.words()).containsExactly("λογοσ");
        assertThat(s.letterStart(1)).isEqualTo(1);
        assertThat(s.letterEnd(1)).isEqualTo(3);
        assertThat(s.wordSpan(0, 1).slice(original)).isEqualTo(original);
    }

    @Test
    void normalize_textWithoutGreekLettersShouldYieldEmptyStreams() {
        NormalizedStream s = GreekNormalizer.normalize("Steph. Byz. p. 630, 12-14!");

        assertThat(s.isEmpty()).isTrue();
        assertThat(s.letters()).isEmpty();
        assertThat(s.words()).isEmpty();
    }

    @Test
    void normalize_shouldDropTokensMadeOnlyOfMarksOrLatinLetters() {
        NormalizedStream s = GreekNormalizer.normalize("\u0301\u0313 logos λόγος 42 ;");

        assertThat(s.words()).containsExactly("λογοσ");
        assertThat(s.wordStart(0)).isEqualTo(9);
    }

    @Test
    void normalize_latinLettersShouldSplitMixedTokens() {
        assertThat(GreekNormalizer.words("λόγοςlogosλόγος")).containsExactly("λογοσ", "λογοσ");
    }

    @Test
    void normalize_shouldBeIdempotentOnLetters() {
        String once = GreekNormalizer.letters("Ἐν ἀρχῇ ἦν ὁ λόγος, καὶ ὁ λόγος ἦν πρὸς τὸν θεόν");

        assertThat(GreekNormalizer.letters(once)).isEqualTo(once);
        assertThat(GreekNormalizer.words(once)).isEqualTo(List.of(once));
    }

    @Test
    void normalize_shouldBeDeterministic() {
        String text = "Ἄβαι, πόλις Φωκίδος· ὁ πολίτης Ἀβαῖος";

        assertThat(GreekNormalizer.normalize(text)).isEqualTo(GreekNormalizer.normalize(text));
    }

    @Test
    void normalize_nullShouldBeRejected() {
        assertThatThrownBy(() -> GreekNormalizer.normalize(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
