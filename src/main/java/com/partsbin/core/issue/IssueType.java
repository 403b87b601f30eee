package com.partsbin.core.issue;

/**
 * Kinds of items that need manual attention after a run.
 */
public enum IssueType {
    AMBIGUOUS_IDENTITY,
    CAPACITY_EXCEEDED,
    UNMATCHED_COMPONENT,
    UNRESOLVED_LOCATION,
    REMOTE_UNAVAILABLE,
    MALFORMED_RECORD;

    /**
     * Issues of these kinds flag a run as needing review.
     */
    public boolean requiresReview() {
        return this != UNRESOLVED_LOCATION && this != UNMATCHED_COMPONENT;
    }
}
