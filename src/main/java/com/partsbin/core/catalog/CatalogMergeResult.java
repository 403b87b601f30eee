package com.partsbin.core.catalog;

import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.model.ComponentSpec;

import java.util.List;

/**
 * Merged component specs in identity-key order, plus the records that were withheld or rejected.
 */
public record CatalogMergeResult(List<ComponentSpec> specs, List<StorageIssue> issues) {

    public CatalogMergeResult {
        specs = List.copyOf(specs);
        issues = List.copyOf(issues);
    }

    public boolean needsReview() {
        return issues.stream().anyMatch(issue -> issue.type().requiresReview());
    }
}
