package com.mnp.stats.alias;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypographicPunctuation.
 */
class TypographicPunctuationTest {

    @Test
    void testFoldsCurlyQuotes() {
        assertThat(TypographicPunctuation.toAscii("Cirqus Voltaire’s “Show”"))
                .isEqualTo("Cirqus Voltaire's \"Show\"");
        assertThat(TypographicPunctuation.hasTypographicQuotes("Jack‘s")).isTrue();
        assertThat(TypographicPunctuation.hasTypographicQuotes("Jack's")).isFalse();
    }

    @Test
    void testAsciiTwinOnlyWhenDifferent() {
        assertThat(TypographicPunctuation.withAsciiTwin("Ripley’s")).containsExactly("Ripley’s", "Ripley's");
        assertThat(TypographicPunctuation.withAsciiTwin("Ripley's")).containsExactly("Ripley's");
    }
}
