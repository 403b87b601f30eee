package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a free-text label onto one known identity of the same category.
 * <p>
 * The label's category is inferred first; candidates of other categories are never scored. Each
 * remaining candidate is scored on normalized text, penalized when the label names a different
 * subtype, and the best one at or above the threshold wins. Anything else is reported unmatched
 * together with the best rejected candidate.
 */
public final class FuzzyMatcher {

    private static final Logger LOGGER = AppLogger.get();

    private final MatcherSettings settings;
    private final NameNormalizer normalizer;
    private final SimilarityScorer lexical = new SequenceRatioScorer();

    public FuzzyMatcher() {
        this(MatcherSettings.defaults(), QualifierRules.defaults());
    }

    public FuzzyMatcher(MatcherSettings settings) {
        this(settings, QualifierRules.defaults());
    }

    public FuzzyMatcher(MatcherSettings settings, QualifierRules rules) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.normalizer = new NameNormalizer(Objects.requireNonNull(rules, "rules"));
    }

    public MatcherSettings settings() {
        return settings;
    }

    public MatchResult match(String query, Collection<MatchCandidate> candidates) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(candidates, "candidates");

        Optional<Category> inferred = CategoryInference.infer(query);
        if (inferred.isEmpty()) {
            LOGGER.fine(() -> "No category inferred for '%s'".formatted(query));
            return MatchResult.unmatched(query, null, null, 0.0);
        }
        return match(query, inferred.get(), candidates);
    }

    /**
     * Scores the label against candidates of a category the caller already knows, skipping inference.
     */
    public MatchResult match(String query, Category category, Collection<MatchCandidate> candidates) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(candidates, "candidates");
        String normalizedQuery = normalizer.normalize(category, query);
        String querySubtype = normalizer.subtypeOf(category, query);

        List<ScoredCandidate> scored = new ArrayList<>();
        for (MatchCandidate candidate : candidates) {
            if (candidate.identity().category() != category) {
                continue;
            }
            String normalizedCandidate = normalizer.normalize(candidate.identity());
            double score = settings.scorer().score(normalizedQuery, normalizedCandidate);
            String subtype = candidate.identity().subtype();
            if (!querySubtype.isEmpty() && !subtype.isEmpty() && !querySubtype.equalsIgnoreCase(subtype)) {
                score = Math.max(0.0, score - settings.subtypePenalty());
            }
            double closeness = lexical.score(normalizedQuery, normalizedCandidate);
            scored.add(new ScoredCandidate(candidate.identity(), candidate.usageCount(), score, closeness));
        }
        if (scored.isEmpty()) {
            return MatchResult.unmatched(query, category, null, 0.0);
        }

        Comparator<ScoredCandidate> order = Comparator.comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing(settings.tieBreakPolicy().comparator());
        scored.sort(order);
        ScoredCandidate best = scored.get(0);
        if (best.score() >= settings.threshold()) {
            return MatchResult.matched(query, best.identity(), best.score());
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Rejected '%s': best %s scored below threshold".formatted(query, best.identity().key()));
        }
        return MatchResult.unmatched(query, category, best.identity(), best.score());
    }
}
