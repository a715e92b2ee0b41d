package it.aw.textoverlap.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunParamsTest {

    @Test
    void defaults_shouldMatchDocumentedValues() {
        RunParams params = RunParams.defaults();

        assertThat(params.metricVersion()).isEqualTo("v1");
        assertThat(params.maxMatchesPerPassage()).isEqualTo(10);
    }

    @Test
    void constructor_shouldStripMetricVersion() {
        assertThat(new RunParams("  v2 ", 3).metricVersion()).isEqualTo("v2");
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new RunParams(" ", 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RunParams(null, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RunParams("v1", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxMatchesPerPassage");
    }

    @Test
    void thresholds_shouldKeepPairsPassingEitherLimit() {
        MatchThresholds thresholds = MatchThresholds.defaults();

        assertThat(thresholds.accepts(result(30, 1))).isTrue();
        assertThat(thresholds.accepts(result(12, 4))).isTrue();
        assertThat(thresholds.accepts(result(29, 3))).isFalse();
        assertThat(thresholds.acceptsEverything()).isFalse();
    }

    @Test
    void thresholds_zeroShouldAcceptEvenEmptyOverlaps() {
        assertThat(MatchThresholds.none().acceptsEverything()).isTrue();
        assertThat(MatchThresholds.none().accepts(OverlapResult.NONE)).isTrue();
        assertThatThrownBy(() -> new MatchThresholds(-1, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textSpan_shouldRejectInvertedBounds() {
        assertThat(new TextSpan(2, 5).slice("αβγδεζ")).isEqualTo("γδε");
        assertThatThrownBy(() -> new TextSpan(5, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    private static OverlapResult result(int charLen, int wordLen) {
        return new OverlapResult(charLen, 0.5, TextSpan.EMPTY, TextSpan.EMPTY,
                wordLen, 0.5, TextSpan.EMPTY, TextSpan.EMPTY);
    }
}
