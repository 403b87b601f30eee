package com.partsbin.core.match;

import java.util.Arrays;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set ratio: compares the shared tokens against each side's full token set, so word order and
 * repeated or extra words weigh less than in a plain sequence ratio.
 */
public final class TokenSetRatioScorer implements SimilarityScorer {

    private final SimilarityScorer base;

    public TokenSetRatioScorer() {
        this(new SequenceRatioScorer());
    }

    public TokenSetRatioScorer(SimilarityScorer base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    @Override
    public double score(String left, String right) {
        SortedSet<String> leftTokens = tokens(left);
        SortedSet<String> rightTokens = tokens(right);
        if (leftTokens.isEmpty() || rightTokens.isEmpty()) {
            return leftTokens.isEmpty() && rightTokens.isEmpty() ? 1.0 : 0.0;
        }

        SortedSet<String> common = new TreeSet<>(leftTokens);
        common.retainAll(rightTokens);
        SortedSet<String> onlyLeft = new TreeSet<>(leftTokens);
        onlyLeft.removeAll(rightTokens);
        SortedSet<String> onlyRight = new TreeSet<>(rightTokens);
        onlyRight.removeAll(leftTokens);

        String shared = String.join(" ", common);
        String leftCombined = join(shared, String.join(" ", onlyLeft));
        String rightCombined = join(shared, String.join(" ", onlyRight));

        double best = base.score(leftCombined, rightCombined);
        if (!shared.isEmpty()) {
            best = Math.max(best, base.score(shared, leftCombined));
            best = Math.max(best, base.score(shared, rightCombined));
        }
        return best;
    }

    private static SortedSet<String> tokens(String text) {
        SortedSet<String> tokens = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        Arrays.stream(text.trim().split("\\s+"))
            .filter(token -> !token.isEmpty())
            .forEach(tokens::add);
        return tokens;
    }

    private static String join(String shared, String rest) {
        if (shared.isEmpty()) {
            return rest;
        }
        return rest.isEmpty() ? shared : shared + " " + rest;
    }
}
