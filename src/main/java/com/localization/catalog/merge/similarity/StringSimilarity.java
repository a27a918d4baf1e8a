package com.localization.catalog.merge.similarity;

/**
 * Similarity score between two strings, from 0.0 (nothing in common) to 1.0 (equal).
 * Implementations must not throw.
 */
@FunctionalInterface
public interface StringSimilarity {

    double score(String left, String right);
}
