package com.localization.catalog.plural;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DefaultPluralRules and PluralFamily.
 */
class DefaultPluralRulesTest {

    private static final long[] SAMPLE_COUNTS = {0, 1, 2, 3, 4, 5, 11, 12, 21, 22, 25, 100, 101, 111, 1000, 1_000_001};

    private final DefaultPluralRules rules = DefaultPluralRules.getInstance();

    @Test
    void testEveryLocaleIsTotal() {
        for (String locale : rules.getSupportedLocales()) {
            PluralFamily family = rules.init(locale);
            for (long count : SAMPLE_COUNTS) {
                assertThat(rules.formIndex(family, count))
                        .as("locale %s, count %d", locale, count)
                        .isBetween(0, rules.formCount(family) - 1);
            }
        }
    }

    @Test
    void testEveryFamilyIsTotalForLargeCounts() {
        for (PluralFamily family : PluralFamily.values()) {
            assertThat(family.select(Long.MAX_VALUE)).isBetween(0, family.getFormCount() - 1);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "en, 0, 1",
            "en, 1, 0",
            "en, 2, 1",
            "fr, 0, 0",
            "fr, 1, 0",
            "fr, 2, 1",
            "ja, 1, 0",
            "ja, 100, 0",
            "pt, 0, 1",
            "pt_BR, 0, 0",
            "pt_BR, 1, 0",
            "pt_BR, 2, 1",
            "ru, 1, 0",
            "ru, 3, 1",
            "ru, 5, 2",
            "ru, 11, 2",
            "ru, 21, 0",
            "ru, 22, 1",
            "cs, 1, 0",
            "cs, 4, 1",
            "cs, 5, 2",
            "pl, 1, 0",
            "pl, 2, 1",
            "pl, 5, 2",
            "pl, 12, 2",
            "pl, 22, 1",
            "ar, 0, 0",
            "ar, 2, 2",
            "ar, 5, 3",
            "ar, 11, 4",
            "ar, 100, 5",
            "ga, 7, 3",
            "ga, 11, 4",
            "sl, 1, 1",
            "sl, 4, 3",
            "sl, 5, 0",
            "lv, 0, 2",
            "lv, 21, 0",
            "is, 11, 1",
            "is, 21, 0",
            "mk, 12, 1",
            "ro, 19, 1",
            "ro, 20, 2"
    })
    void testFormIndex(String locale, long count, int expected) {
        assertThat(rules.formIndexFor(locale, count)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "en, 2",
            "EN-us, 2",
            "de_AT, 2",
            "ja, 1",
            "pl, 3",
            "ar, 6",
            "ga, 5",
            "cy, 4"
    })
    void testFormCount(String locale, int expected) {
        assertThat(rules.formCountFor(locale)).isEqualTo(expected);
    }

    @Test
    void testExactLocaleWinsOverLanguage() {
        assertThat(rules.init("pt_BR")).isEqualTo(PluralFamily.TWO_FORMS_GREATER_THAN_ONE);
        assertThat(rules.init("pt-br")).isEqualTo(PluralFamily.TWO_FORMS_GREATER_THAN_ONE);
        assertThat(rules.init("pt_PT")).isEqualTo(PluralFamily.TWO_FORMS_NOT_ONE);
    }

    @Test
    void testUnknownLocaleFallsBack() {
        assertThat(rules.isSupported("tlh")).isFalse();
        assertThat(rules.init("tlh")).isEqualTo(PluralFamily.TWO_FORMS_NOT_ONE);
        assertThat(rules.init("")).isEqualTo(PluralFamily.TWO_FORMS_NOT_ONE);
        assertThat(rules.formIndexFor("tlh", 1)).isZero();
    }

    @Test
    void testPluralFormsHeader() {
        assertThat(rules.pluralFormsHeaderFor("it")).isEqualTo("nplurals=2; plural=(n != 1);");
        assertThat(rules.pluralFormsHeaderFor("ja")).isEqualTo("nplurals=1; plural=0;");
    }

    @Test
    void testNegativeCountIsRejected() {
        assertThatThrownBy(() -> rules.formIndexFor("en", -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void testCustomRulesThroughInterface() {
        PluralRules<String> elvish = new PluralRules<>() {
            @Override
            public String init(String locale) {
                return locale;
            }

            @Override
            public int formCount(String state) {
                return 3;
            }

            @Override
            public int formIndex(String state, long count) {
                PluralRules.validateCount(count);
                return count == 0 ? 0 : count == 1 ? 1 : 2;
            }
        };

        assertThat(elvish.formIndexFor("elv", 0)).isZero();
        assertThat(elvish.formIndexFor("elv", 7)).isEqualTo(2);
        assertThat(elvish.pluralFormsHeaderFor("elv")).isEqualTo("nplurals=3");
    }
}
