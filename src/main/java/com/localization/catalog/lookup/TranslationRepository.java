package com.localization.catalog.lookup;

import com.localization.catalog.interpolation.Interpolation;
import com.localization.catalog.model.Entry;
import com.localization.catalog.model.PluralEntry;
import com.localization.catalog.model.SingularEntry;
import com.localization.catalog.model.TextFragments;
import com.localization.catalog.plural.DefaultPluralRules;
import com.localization.catalog.plural.PluralRules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime lookup of translations from parsed catalogs.
 *
 * <p>Entries are indexed by (locale, domain, msgctxt, msgid). The locale is an
 * explicit argument of every call; there is no current-locale state. A
 * translation that is missing, empty, or fuzzy (unless {@code includeFuzzy} is
 * set) falls back to the source text. The result is always interpolated.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * TranslationRepository repository = TranslationRepository.builder()
 *         .catalog(DomainCatalog.of("it", "default", catalog))
 *         .build();
 * repository.ngettext("it", "default", null, "One file", "%{count} files", 3, Map.of());
 * }</pre>
 */
public class TranslationRepository {
    private static final Logger log = LoggerFactory.getLogger(TranslationRepository.class);

    public static final String COUNT_BINDING = "count";

    private final Map<LookupKey, Entry> entries;
    private final PluralRules<?> pluralRules;
    private final boolean includeFuzzy;

    @Builder
    private TranslationRepository(@Singular List<DomainCatalog> catalogs, PluralRules<?> pluralRules,
                                  boolean includeFuzzy) {
        Map<LookupKey, Entry> index = new HashMap<>();
        for (DomainCatalog source : catalogs) {
            for (Entry entry : source.getCatalog().activeEntries()) {
                index.put(new LookupKey(source.getLocale(), source.getDomain(), entry.msgctxtText(), entry.msgidText()),
                        entry);
            }
        }
        this.entries = Map.copyOf(index);
        this.pluralRules = pluralRules == null ? DefaultPluralRules.getInstance() : pluralRules;
        this.includeFuzzy = includeFuzzy;
        log.debug("Indexed {} translations from {} catalogs", entries.size(), catalogs.size());
    }

    public Optional<Entry> find(String locale, String domain, String msgctxt, String msgid) {
        return Optional.ofNullable(entries.get(new LookupKey(locale, domain, msgctxt, msgid)));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Translates a singular message.
     *
     * @throws com.localization.catalog.interpolation.MissingBindingsException if a placeholder has no binding
     */
    public String gettext(String locale, String domain, String msgctxt, String msgid, Map<String, ?> bindings) {
        String text = find(locale, domain, msgctxt, msgid)
                .filter(this::isUsable)
                .map(this::singularText)
                .filter(translation -> !translation.isEmpty())
                .orElseGet(() -> {
                    log.debug("No translation for '{}' in {}/{}, using msgid", msgid, locale, domain);
                    return msgid;
                });
        return Interpolation.render(text, bindings);
    }

    /**
     * Translates a plural message for {@code count}, which is also bound as {@code %{count}}.
     *
     * @throws PluralFormException if the translation lacks the form the locale selects
     * @throws com.localization.catalog.interpolation.MissingBindingsException if a placeholder has no binding
     */
    public String ngettext(String locale, String domain, String msgctxt, String msgid, String msgidPlural,
                           long count, Map<String, ?> bindings) {
        Map<String, Object> allBindings = new HashMap<>();
        if (bindings != null) {
            allBindings.putAll(bindings);
        }
        allBindings.put(COUNT_BINDING, count);

        Optional<PluralEntry> entry = find(locale, domain, msgctxt, msgid)
                .filter(this::isUsable)
                .filter(PluralEntry.class::isInstance)
                .map(PluralEntry.class::cast);

        String text = null;
        if (entry.isPresent()) {
            int form = pluralRules.formIndexFor(locale, count);
            PluralEntry plural = entry.get();
            if (!plural.hasForm(form) && hasAnyTranslation(plural)) {
                throw new PluralFormException(form, locale, msgid, plural.getLine());
            }
            text = plural.msgstrText(form);
        }
        if (text == null || text.isEmpty()) {
            log.debug("No plural translation for '{}' in {}/{}, using source text", msgid, locale, domain);
            text = count == 1 ? msgid : msgidPlural;
        }
        return Interpolation.render(text, allBindings);
    }

    private boolean isUsable(Entry entry) {
        return includeFuzzy || !entry.isFuzzy();
    }

    private boolean hasAnyTranslation(PluralEntry entry) {
        return entry.getMsgstr().values().stream().anyMatch(fragments -> !TextFragments.isBlank(fragments));
    }

    private String singularText(Entry entry) {
        if (entry instanceof SingularEntry singular) {
            return singular.msgstrText();
        }
        String first = ((PluralEntry) entry).msgstrText(0);
        return first == null ? "" : first;
    }

    @Value
    private static class LookupKey {
        String locale;
        String domain;
        String msgctxt;
        String msgid;
    }
}
