package com.partsbin.core.match;

/**
 * Similarity between two normalized strings, in the range 0.0 (unrelated) to 1.0 (identical).
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(String left, String right);
}
