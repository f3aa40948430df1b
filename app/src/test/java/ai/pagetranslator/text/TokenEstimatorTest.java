package ai.pagetranslator.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TokenEstimatorTest {

    @Test
    void countsWordsAndPunctuation() {
        assertThat(TokenEstimator.estimate("Hello, world!")).isEqualTo(4);
        assertThat(TokenEstimator.estimate("{\"a\": 1}")).isEqualTo(7);
    }

    @Test
    void returnsZeroForBlankInput() {
        assertThat(TokenEstimator.estimate(null)).isZero();
        assertThat(TokenEstimator.estimate("   ")).isZero();
    }
}
