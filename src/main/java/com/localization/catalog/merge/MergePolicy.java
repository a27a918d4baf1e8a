package com.localization.catalog.merge;

import com.localization.catalog.merge.similarity.JaroSimilarity;
import com.localization.catalog.merge.similarity.StringSimilarity;
import com.localization.catalog.plural.DefaultPluralRules;
import com.localization.catalog.plural.PluralRules;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Options of a catalog merge. Unset builder values take their defaults:
 * obsolete entries are marked, fuzzy matching is on with a threshold of 0.8,
 * plural rules come from {@link DefaultPluralRules} and similarity from
 * {@link JaroSimilarity}.
 */
@Value
public class MergePolicy {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    private static final Pattern NPLURALS = Pattern.compile("nplurals\\s*=\\s*(\\d+)");

    ObsoletePolicy onObsolete;
    double fuzzyThreshold;
    boolean fuzzyMatching;
    boolean storePreviousMessageOnFuzzyMatch;
    /** Overrides the Plural-Forms header derived from the locale; null to derive it. */
    String pluralFormsHeader;
    PluralRules<?> pluralRules;
    StringSimilarity similarity;

    @Builder
    private MergePolicy(ObsoletePolicy onObsolete, Double fuzzyThreshold, Boolean fuzzyMatching,
                        boolean storePreviousMessageOnFuzzyMatch, String pluralFormsHeader,
                        PluralRules<?> pluralRules, StringSimilarity similarity) {
        double threshold = fuzzyThreshold == null ? DEFAULT_FUZZY_THRESHOLD : fuzzyThreshold;
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new PolicyException("Fuzzy threshold must be between 0.0 and 1.0, got " + fuzzyThreshold);
        }
        if (pluralFormsHeader != null) {
            parseFormCount(pluralFormsHeader);
        }

        this.onObsolete = onObsolete == null ? ObsoletePolicy.MARK_AS_OBSOLETE : onObsolete;
        this.fuzzyThreshold = threshold;
        this.fuzzyMatching = fuzzyMatching == null || fuzzyMatching;
        this.storePreviousMessageOnFuzzyMatch = storePreviousMessageOnFuzzyMatch;
        this.pluralFormsHeader = pluralFormsHeader;
        this.pluralRules = pluralRules == null ? DefaultPluralRules.getInstance() : pluralRules;
        this.similarity = similarity == null ? JaroSimilarity.getInstance() : similarity;
    }

    public static MergePolicy defaults() {
        return builder().build();
    }

    /**
     * Reads {@code nplurals=N} out of a Plural-Forms header value.
     *
     * @throws PolicyException if the value has no positive nplurals
     */
    public static int parseFormCount(String pluralFormsHeader) {
        Matcher matcher = NPLURALS.matcher(pluralFormsHeader);
        if (!matcher.find() || matcher.group(1).length() > 3 || Integer.parseInt(matcher.group(1)) < 1) {
            throw new PolicyException("Plural-Forms header must declare nplurals=N: '" + pluralFormsHeader + "'");
        }
        return Integer.parseInt(matcher.group(1));
    }
}
