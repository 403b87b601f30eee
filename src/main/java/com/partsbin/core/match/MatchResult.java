package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one free-text label. An unmatched result still reports the best rejected candidate
 * so it can be resolved by hand.
 */
public final class MatchResult {

    private final String query;
    private final Category category;
    private final ComponentIdentity identity;
    private final double score;
    private final boolean matched;

    private MatchResult(String query, Category category, ComponentIdentity identity, double score, boolean matched) {
        this.query = Objects.requireNonNull(query, "query");
        this.category = category;
        this.identity = identity;
        this.score = score;
        this.matched = matched;
    }

    public static MatchResult matched(String query, ComponentIdentity identity, double score) {
        Objects.requireNonNull(identity, "identity");
        return new MatchResult(query, identity.category(), identity, score, true);
    }

    public static MatchResult unmatched(String query, Category category, ComponentIdentity bestRejected, double bestScore) {
        return new MatchResult(query, category, bestRejected, bestRejected == null ? 0.0 : bestScore, false);
    }

    public String query() {
        return query;
    }

    public boolean isMatched() {
        return matched;
    }

    public Optional<ComponentIdentity> identity() {
        return matched ? Optional.of(identity) : Optional.empty();
    }

    /**
     * Confidence of the selected identity, or of the best rejected candidate when unmatched.
     */
    public double score() {
        return score;
    }

    public Optional<Category> inferredCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<ComponentIdentity> bestRejected() {
        return matched ? Optional.empty() : Optional.ofNullable(identity);
    }

    public String describe() {
        if (matched) {
            return String.format(Locale.ROOT, "%s -> %s (%.2f)", query, identity.key(), score);
        }
        if (category == null) {
            return "%s: no category could be inferred".formatted(query);
        }
        if (identity == null) {
            return "%s: no %s candidates".formatted(query, category.key());
        }
        return String.format(Locale.ROOT, "%s: best candidate %s scored %.2f", query, identity.key(), score);
    }

    @Override
    public String toString() {
        return describe();
    }
}
