package com.partsbin.core.match;

import java.util.Comparator;

/**
 * Orders candidates that reached the same similarity score.
 */
public enum TieBreakPolicy {
    /** Higher usage count first, then lexical closeness, then identity key. */
    USAGE_FIRST,
    /** Lexical closeness first, then higher usage count, then identity key. */
    LEXICAL_FIRST;

    Comparator<ScoredCandidate> comparator() {
        Comparator<ScoredCandidate> usage = Comparator.comparingInt(ScoredCandidate::usageCount).reversed();
        Comparator<ScoredCandidate> lexical = Comparator.comparingDouble(ScoredCandidate::lexicalCloseness).reversed();
        Comparator<ScoredCandidate> primary = this == USAGE_FIRST ? usage.thenComparing(lexical) : lexical.thenComparing(usage);
        return primary.thenComparing(candidate -> candidate.identity().key());
    }
}
