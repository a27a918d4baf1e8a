package com.localization.catalog.merge.similarity;

/**
 * Jaro similarity over Unicode code points. Case-sensitive.
 *
 * <p>Two code points match when they are equal and no further apart than
 * {@code max(len1, len2) / 2 - 1}; the score combines the share of matched
 * code points in each string with the number of transpositions.</p>
 */
public class JaroSimilarity implements StringSimilarity {

    private static final JaroSimilarity INSTANCE = new JaroSimilarity();

    private JaroSimilarity() {
    }

    public static JaroSimilarity getInstance() {
        return INSTANCE;
    }

    @Override
    public double score(String left, String right) {
        int[] a = left == null ? new int[0] : left.codePoints().toArray();
        int[] b = right == null ? new int[0] : right.codePoints().toArray();

        if (a.length == 0 && b.length == 0) {
            return 1.0;
        }
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }

        int window = Math.max(0, Math.max(a.length, b.length) / 2 - 1);
        boolean[] aMatched = new boolean[a.length];
        boolean[] bMatched = new boolean[b.length];
        int matches = 0;

        for (int i = 0; i < a.length; i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!bMatched[j] && a[i] == b[j]) {
                    aMatched[i] = true;
                    bMatched[j] = true;
                    matches++;
                    break;
                }
            }
        }

        if (matches == 0) {
            return 0.0;
        }

        int outOfOrder = 0;
        int k = 0;
        for (int i = 0; i < a.length; i++) {
            if (!aMatched[i]) {
                continue;
            }
            while (!bMatched[k]) {
                k++;
            }
            if (a[i] != b[k]) {
                outOfOrder++;
            }
            k++;
        }

        double m = matches;
        double transpositions = outOfOrder / 2.0;
        return (m / a.length + m / b.length + (m - transpositions) / m) / 3.0;
    }
}
