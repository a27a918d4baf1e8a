package com.localization.catalog.merge.similarity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JaroSimilarityTest {

    private final JaroSimilarity jaro = JaroSimilarity.getInstance();

    @Test
    void testIdenticalAndEmptyStrings() {
        assertThat(jaro.score("hello", "hello")).isEqualTo(1.0);
        assertThat(jaro.score("", "")).isEqualTo(1.0);
        assertThat(jaro.score("", "a")).isZero();
        assertThat(jaro.score(null, "a")).isZero();
    }

    @Test
    void testKnownValues() {
        assertThat(jaro.score("MARTHA", "MARHTA")).isCloseTo(0.944, within(0.001));
        assertThat(jaro.score("DIXON", "DICKSONX")).isCloseTo(0.767, within(0.001));
        assertThat(jaro.score("Hello World", "Hello Worlds")).isCloseTo(0.972, within(0.001));
    }

    @Test
    void testNoCommonCharacters() {
        assertThat(jaro.score("abc", "xyz")).isZero();
    }

    @Test
    void testCaseSensitive() {
        assertThat(jaro.score("ABC", "abc")).isZero();
    }

    @Test
    void testSymmetric() {
        assertThat(jaro.score("crate", "trace")).isEqualTo(jaro.score("trace", "crate"));
    }
}
