package com.partsbin.core.match;

import java.util.Objects;

/**
 * Tunable matcher behavior.
 *
 * @param threshold      minimum score for a match; a score equal to the threshold is accepted
 * @param scorer         similarity function applied to normalized text
 * @param subtypePenalty subtracted from a candidate whose subtype differs from the one the query names
 * @param tieBreakPolicy ordering of equally scored candidates
 */
public record MatcherSettings(double threshold,
                              SimilarityScorer scorer,
                              double subtypePenalty,
                              TieBreakPolicy tieBreakPolicy) {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final double DEFAULT_SUBTYPE_PENALTY = 0.15;

    public MatcherSettings {
        Objects.requireNonNull(scorer, "scorer");
        Objects.requireNonNull(tieBreakPolicy, "tieBreakPolicy");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Match threshold must be within 0..1: " + threshold);
        }
        if (subtypePenalty < 0.0 || subtypePenalty > 1.0) {
            throw new IllegalArgumentException("Subtype penalty must be within 0..1: " + subtypePenalty);
        }
    }

    public static MatcherSettings defaults() {
        return new MatcherSettings(DEFAULT_THRESHOLD, new TokenSetRatioScorer(), DEFAULT_SUBTYPE_PENALTY, TieBreakPolicy.USAGE_FIRST);
    }

    public MatcherSettings withThreshold(double value) {
        return new MatcherSettings(value, scorer, subtypePenalty, tieBreakPolicy);
    }

    public MatcherSettings withScorer(SimilarityScorer value) {
        return new MatcherSettings(threshold, value, subtypePenalty, tieBreakPolicy);
    }

    public MatcherSettings withTieBreakPolicy(TieBreakPolicy value) {
        return new MatcherSettings(threshold, scorer, subtypePenalty, value);
    }
}
