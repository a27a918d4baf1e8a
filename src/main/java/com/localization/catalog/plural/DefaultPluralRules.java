package com.localization.catalog.plural;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in plural rules covering the language families known to gettext.
 *
 * <p>Lookup tries the full locale first ({@code pt_BR} differs from {@code pt}),
 * then the language before the first {@code _} or {@code -}. Matching is
 * case-insensitive. Locales that are not in the table use the English rule
 * ({@code n != 1}).</p>
 *
 * <h3>Examples:</h3>
 * <pre>
 * en    (count=1): 0   (count=5): 1
 * pt_BR (count=0): 0   (count=2): 1
 * pl    (count=3): 1   (count=5): 2
 * ar    (count=100): 5
 * </pre>
 */
public class DefaultPluralRules implements PluralRules<PluralFamily> {
    private static final Logger log = LoggerFactory.getLogger(DefaultPluralRules.class);

    private static final DefaultPluralRules INSTANCE = new DefaultPluralRules();
    private static final PluralFamily FALLBACK = PluralFamily.TWO_FORMS_NOT_ONE;
    private static final Map<String, PluralFamily> LOCALES = buildTable();

    private DefaultPluralRules() {
    }

    public static DefaultPluralRules getInstance() {
        return INSTANCE;
    }

    @Override
    public PluralFamily init(String locale) {
        PluralFamily family = lookup(locale);
        if (family == null) {
            log.debug("No plural rules for locale '{}', falling back to {}", locale, FALLBACK);
            return FALLBACK;
        }
        return family;
    }

    @Override
    public int formCount(PluralFamily family) {
        return family.getFormCount();
    }

    @Override
    public int formIndex(PluralFamily family, long count) {
        return family.select(count);
    }

    @Override
    public String pluralFormsHeader(PluralFamily family) {
        return family.pluralFormsHeader();
    }

    /**
     * Whether the locale (or its language) has an entry in the table.
     */
    public boolean isSupported(String locale) {
        return lookup(locale) != null;
    }

    public Set<String> getSupportedLocales() {
        return LOCALES.keySet();
    }

    private PluralFamily lookup(String locale) {
        if (locale == null || locale.isBlank()) {
            return null;
        }
        String normalized = locale.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        PluralFamily family = LOCALES.get(normalized);
        if (family != null) {
            return family;
        }
        int separator = normalized.indexOf('_');
        return separator > 0 ? LOCALES.get(normalized.substring(0, separator)) : null;
    }

    private static Map<String, PluralFamily> buildTable() {
        Map<String, PluralFamily> table = new HashMap<>();
        register(table, PluralFamily.ONE_FORM,
                "ay", "bo", "cgg", "dz", "fa", "id", "ja", "jbo", "ka", "kk", "km", "ko", "ky", "lo",
                "ms", "my", "sah", "su", "th", "tt", "ug", "vi", "wo", "zh");
        register(table, PluralFamily.TWO_FORMS_NOT_ONE,
                "af", "an", "anp", "as", "ast", "az", "bg", "bn", "brx", "ca", "da", "de", "doi", "el",
                "en", "eo", "es", "et", "eu", "ff", "fi", "fo", "fur", "fy", "gl", "gu", "ha", "he",
                "hi", "hne", "hy", "hu", "ia", "it", "kl", "kn", "ku", "lb", "mai", "ml", "mn", "mni",
                "mr", "nah", "nap", "nb", "ne", "nl", "se", "nn", "no", "nso", "or", "ps", "pa", "pap",
                "pms", "pt", "rm", "rw", "sat", "sco", "sd", "si", "so", "son", "sq", "sw", "sv", "ta",
                "te", "tk", "ur", "yo");
        register(table, PluralFamily.TWO_FORMS_GREATER_THAN_ONE,
                "ach", "ak", "am", "arn", "br", "fil", "fr", "gun", "ln", "mfe", "mg", "mi", "oc",
                "tg", "ti", "tl", "tr", "uz", "wa", "pt_br");
        register(table, PluralFamily.SLAVIC, "be", "bs", "hr", "sr", "ru", "uk");
        register(table, PluralFamily.CZECH_SLOVAK, "cs", "sk");
        register(table, PluralFamily.ARABIC, "ar");
        register(table, PluralFamily.KASHUBIAN, "csb");
        register(table, PluralFamily.WELSH, "cy");
        register(table, PluralFamily.IRISH, "ga");
        register(table, PluralFamily.SCOTTISH_GAELIC, "gd");
        register(table, PluralFamily.ICELANDIC, "is");
        register(table, PluralFamily.JAVANESE, "jv");
        register(table, PluralFamily.CORNISH, "kw");
        register(table, PluralFamily.LITHUANIAN, "lt");
        register(table, PluralFamily.LATVIAN, "lv");
        register(table, PluralFamily.MACEDONIAN, "mk");
        register(table, PluralFamily.MANDINKA, "mnk");
        register(table, PluralFamily.MALTESE, "mt");
        register(table, PluralFamily.POLISH, "pl");
        register(table, PluralFamily.ROMANIAN, "ro");
        register(table, PluralFamily.SLOVENIAN, "sl");
        return Map.copyOf(table);
    }

    private static void register(Map<String, PluralFamily> table, PluralFamily family, String... locales) {
        for (String locale : locales) {
            table.put(locale, family);
        }
    }
}
