package com.partsbin.core.picking;

import com.partsbin.core.issue.StorageIssue;

import java.util.List;

/**
 * A BOM laid out in walking order.
 *
 * @param title   build name shown in the header
 * @param entries every entry in walking order (groups flattened)
 * @param groups  groups in walking order, the unlocated group last
 * @param summary totals and shortage list
 * @param issues  unmatched names and unresolved locations
 */
public record PickingSheet(String title,
                           List<PickListEntry> entries,
                           List<PickGroup> groups,
                           PickingSummary summary,
                           List<StorageIssue> issues) {

    public PickingSheet {
        title = title == null ? "" : title;
        entries = List.copyOf(entries);
        groups = List.copyOf(groups);
        issues = List.copyOf(issues);
    }

    public boolean needsAttention() {
        return !issues.isEmpty() || summary.itemsShort() > 0;
    }
}
