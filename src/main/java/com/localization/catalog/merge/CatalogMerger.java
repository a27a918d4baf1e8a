package com.localization.catalog.merge;

import com.localization.catalog.model.Catalog;
import com.localization.catalog.model.Entry;
import com.localization.catalog.model.EntryKey;
import com.localization.catalog.model.PluralEntry;
import com.localization.catalog.model.PreviousMessage;
import com.localization.catalog.model.SingularEntry;
import com.localization.catalog.plural.PluralRules;

import lombok.Value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges a translated catalog with a freshly extracted template.
 *
 * <p>The template decides which entries exist and in which order; the old
 * catalog contributes translations. Each template entry is resolved as:</p>
 * <ol>
 *   <li>an exact match on (msgctxt, msgid), which keeps the old translation;</li>
 *   <li>otherwise the most similar unmatched old msgid at or above the fuzzy
 *       threshold, whose translation is kept and flagged {@code fuzzy};</li>
 *   <li>otherwise a new untranslated entry.</li>
 * </ol>
 * <p>Old entries left unmatched are appended as obsolete or dropped, depending
 * on {@link MergePolicy#getOnObsolete()}.</p>
 */
public class CatalogMerger {
    private static final Logger log = LoggerFactory.getLogger(CatalogMerger.class);

    static final List<String> NEW_CATALOG_COMMENT = List.of(
            "## This catalog was created from a template. Entry ids (msgid and",
            "## msgctxt) come from the source code: change them there and merge",
            "## again rather than editing them in this file.");

    public MergeResult merge(Catalog old, Catalog template, String locale, MergePolicy policy) {
        PluralTarget plural = resolvePlural(policy, locale);

        List<Entry> oldActive = old.activeEntries();
        Map<EntryKey, Entry> oldByKey = new HashMap<>();
        for (Entry entry : oldActive) {
            oldByKey.putIfAbsent(entry.key(), entry);
        }
        Set<Entry> consumed = Collections.newSetFromMap(new IdentityHashMap<>());

        List<Entry> templateEntries = template.activeEntries();
        Entry[] merged = new Entry[templateEntries.size()];
        int unchanged = 0;
        int fuzzy = 0;
        int fresh = 0;

        // All exact matches are resolved before any fuzzy match
        for (int i = 0; i < templateEntries.size(); i++) {
            Entry candidate = templateEntries.get(i);
            Entry match = oldByKey.get(candidate.key());
            if (match != null && consumed.add(match)) {
                merged[i] = mergeExact(match, candidate, plural.getFormCount());
                unchanged++;
            }
        }

        for (int i = 0; i < templateEntries.size(); i++) {
            if (merged[i] != null) {
                continue;
            }
            Entry candidate = templateEntries.get(i);
            Entry match = policy.isFuzzyMatching() ? findFuzzyMatch(candidate, oldActive, consumed, policy) : null;
            if (match != null) {
                consumed.add(match);
                merged[i] = mergeFuzzy(match, candidate, plural.getFormCount(), policy.isStorePreviousMessageOnFuzzyMatch());
                fuzzy++;
            } else {
                merged[i] = freshEntry(candidate, plural.getFormCount(), false);
                fresh++;
            }
        }

        Catalog.CatalogBuilder result = Catalog.builder()
                .topComments(old.getTopComments())
                .headers(mergeHeaders(old.getHeaders(), locale, plural.getHeader()))
                .entries(List.of(merged));

        int obsolete = 0;
        int removed = 0;
        for (Entry entry : old.getEntries()) {
            if (entry.isObsolete()) {
                if (policy.getOnObsolete() == ObsoletePolicy.MARK_AS_OBSOLETE) {
                    result.entry(entry);
                } else {
                    removed++;
                }
            } else if (!consumed.contains(entry)) {
                if (policy.getOnObsolete() == ObsoletePolicy.MARK_AS_OBSOLETE) {
                    result.entry(entry.asObsolete());
                    obsolete++;
                } else {
                    removed++;
                }
            }
        }

        ChangeSummary summary = ChangeSummary.builder()
                .newEntries(fresh)
                .unchanged(unchanged)
                .fuzzy(fuzzy)
                .obsolete(obsolete)
                .removed(removed)
                .build();
        log.debug("Merged catalog for locale '{}': {}", locale, summary);
        return new MergeResult(result.build(), summary);
    }

    /**
     * Builds a catalog for a locale that has no translations yet. Developer
     * comments ({@code ##}) of the template are not copied.
     */
    public MergeResult createFromTemplate(Catalog template, String locale, MergePolicy policy) {
        PluralTarget plural = resolvePlural(policy, locale);

        Catalog.CatalogBuilder result = Catalog.builder()
                .topComments(NEW_CATALOG_COMMENT)
                .headers(mergeHeaders(Map.of(), locale, plural.getHeader()));

        List<Entry> entries = template.activeEntries();
        for (Entry entry : entries) {
            result.entry(freshEntry(entry, plural.getFormCount(), true));
        }

        ChangeSummary summary = ChangeSummary.builder().newEntries(entries.size()).build();
        log.debug("Created catalog for locale '{}' with {} entries", locale, entries.size());
        return new MergeResult(result.build(), summary);
    }

    private Entry findFuzzyMatch(Entry candidate, List<Entry> oldActive, Set<Entry> consumed, MergePolicy policy) {
        String msgid = candidate.msgidText();
        Entry best = null;
        double bestScore = -1.0;
        for (Entry entry : oldActive) {
            if (consumed.contains(entry)) {
                continue;
            }
            double score = policy.getSimilarity().score(entry.msgidText(), msgid);
            // strict comparison keeps the earliest old entry on ties
            if (score >= policy.getFuzzyThreshold() && score > bestScore) {
                best = entry;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Fuzzy match for '{}': '{}' (score {})", msgid, best.msgidText(), bestScore);
        }
        return best;
    }

    private Entry mergeExact(Entry old, Entry template, int formCount) {
        Set<String> flags = new TreeSet<>(template.getFlags());
        old.getFlags().stream()
                .filter(flag -> !Entry.FUZZY_FLAG.equals(flag))
                .forEach(flags::add);
        return translatedCopy(old, template, formCount, flags, null);
    }

    private Entry mergeFuzzy(Entry old, Entry template, int formCount, boolean storePrevious) {
        Set<String> flags = new TreeSet<>(template.getFlags());
        flags.add(Entry.FUZZY_FLAG);
        PreviousMessage previous = storePrevious ? PreviousMessage.of(old) : null;
        return translatedCopy(old, template, formCount, flags, previous);
    }

    /**
     * Template identity and source information with the translation of the old entry.
     */
    private Entry translatedCopy(Entry old, Entry template, int formCount, Set<String> flags,
                                 PreviousMessage previous) {
        if (template instanceof PluralEntry pluralTemplate) {
            return PluralEntry.builder()
                    .msgctxt(template.getMsgctxt())
                    .msgid(template.getMsgid())
                    .msgidPlural(pluralTemplate.getMsgidPlural())
                    .msgstr(pluralTranslation(old, formCount))
                    .comments(old.getComments())
                    .extractedComments(template.getExtractedComments())
                    .references(template.getReferences())
                    .flags(flags)
                    .previousMessage(previous)
                    .line(template.getLine())
                    .build();
        }
        return SingularEntry.builder()
                .msgctxt(template.getMsgctxt())
                .msgid(template.getMsgid())
                .msgstr(singularTranslation(old))
                .comments(old.getComments())
                .extractedComments(template.getExtractedComments())
                .references(template.getReferences())
                .flags(flags)
                .previousMessage(previous)
                .line(template.getLine())
                .build();
    }

    private Entry freshEntry(Entry template, int formCount, boolean stripDeveloperComments) {
        List<String> comments = stripDeveloperComments
                ? template.getComments().stream().filter(comment -> !comment.startsWith("#")).toList()
                : template.getComments();

        if (template instanceof PluralEntry pluralTemplate) {
            Map<Integer, List<String>> forms = new TreeMap<>();
            for (int i = 0; i < formCount; i++) {
                forms.put(i, List.of(""));
            }
            return PluralEntry.builder()
                    .msgctxt(template.getMsgctxt())
                    .msgid(template.getMsgid())
                    .msgidPlural(pluralTemplate.getMsgidPlural())
                    .msgstr(forms)
                    .comments(comments)
                    .extractedComments(template.getExtractedComments())
                    .references(template.getReferences())
                    .flags(template.getFlags())
                    .line(template.getLine())
                    .build();
        }
        return SingularEntry.builder()
                .msgctxt(template.getMsgctxt())
                .msgid(template.getMsgid())
                .msgstr(List.of(""))
                .comments(comments)
                .extractedComments(template.getExtractedComments())
                .references(template.getReferences())
                .flags(template.getFlags())
                .line(template.getLine())
                .build();
    }

    private List<String> singularTranslation(Entry old) {
        if (old instanceof SingularEntry singular) {
            return singular.getMsgstr();
        }
        List<String> first = ((PluralEntry) old).getMsgstr().get(0);
        return first == null ? List.of("") : first;
    }

    /**
     * Plural forms of the old entry padded with empty forms up to {@code formCount}.
     * A singular translation is copied into every form.
     */
    private Map<Integer, List<String>> pluralTranslation(Entry old, int formCount) {
        TreeMap<Integer, List<String>> forms = new TreeMap<>();
        if (old instanceof SingularEntry singular) {
            for (int i = 0; i < formCount; i++) {
                forms.put(i, singular.getMsgstr());
            }
            return forms;
        }

        forms.putAll(((PluralEntry) old).getMsgstr());
        if (!forms.isEmpty() && forms.lastKey() >= formCount) {
            log.warn("Entry '{}' has {} plural forms but the locale uses {}",
                    old.msgidText(), forms.size(), formCount);
        }
        for (int i = 0; i < formCount; i++) {
            forms.putIfAbsent(i, List.of(""));
        }
        return forms;
    }

    private Map<String, String> mergeHeaders(Map<String, String> oldHeaders, String locale, String pluralForms) {
        Map<String, String> headers = new LinkedHashMap<>(oldHeaders);
        headers.put("Language", locale);
        headers.put("Plural-Forms", pluralForms);
        return headers;
    }

    private PluralTarget resolvePlural(MergePolicy policy, String locale) {
        String override = policy.getPluralFormsHeader();
        if (override != null) {
            return new PluralTarget(MergePolicy.parseFormCount(override), override);
        }
        PluralRules<?> rules = policy.getPluralRules();
        return new PluralTarget(rules.formCountFor(locale), rules.pluralFormsHeaderFor(locale));
    }

    @Value
    private static class PluralTarget {
        int formCount;
        String header;
    }
}
