package com.localization.catalog.plural;

/**
 * Source of plural rules for locales.
 *
 * <p>{@link #init(String)} resolves a locale once into an implementation-defined
 * state that the other operations take back, so implementations backed by
 * expensive data can prepare it a single time per locale.</p>
 *
 * @param <S> per-locale state produced by {@link #init(String)}
 */
public interface PluralRules<S> {

    /**
     * Resolves the rules for a locale such as {@code "pt_BR"} or {@code "pl"}.
     */
    S init(String locale);

    /**
     * Number of plural forms (the gettext {@code nplurals}).
     */
    int formCount(S state);

    /**
     * Index of the form used for {@code count}, in {@code [0, formCount)}.
     *
     * @throws IllegalArgumentException if count is negative
     */
    int formIndex(S state, long count);

    /**
     * Value of the {@code Plural-Forms} header for catalogs in this locale.
     */
    default String pluralFormsHeader(S state) {
        return "nplurals=" + formCount(state);
    }

    default int formCountFor(String locale) {
        return formCount(init(locale));
    }

    default int formIndexFor(String locale, long count) {
        return formIndex(init(locale), count);
    }

    default String pluralFormsHeaderFor(String locale) {
        return pluralFormsHeader(init(locale));
    }

    /**
     * Validates that the given count is acceptable for plural rule evaluation.
     *
     * @throws IllegalArgumentException if count is negative
     */
    static void validateCount(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
    }
}
