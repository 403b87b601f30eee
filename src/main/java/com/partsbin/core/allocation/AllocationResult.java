package com.partsbin.core.allocation;

import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one allocation run: the extended map, what was added, and what needs attention.
 *
 * @param locationMap prior entries plus the new placements (version unchanged)
 * @param added       new placements in identity-key order
 * @param issues      categories that could not be placed and similar problems
 */
public record AllocationResult(LocationMap locationMap,
                               Map<ComponentIdentity, List<StorageSlot>> added,
                               List<StorageIssue> issues) {

    public AllocationResult {
        added = Collections.unmodifiableMap(new TreeMap<>(added));
        issues = List.copyOf(issues);
    }

    public boolean needsReview() {
        return issues.stream().anyMatch(issue -> issue.type().requiresReview());
    }

    public boolean hasChanges() {
        return !added.isEmpty();
    }
}
