package com.partsbin.core.issue;

import com.partsbin.core.model.Category;

import java.util.Objects;

/**
 * Thrown when the drawers still free in a category's reserved range cannot hold its new groups.
 */
public class CapacityExceededException extends Exception {

    private final Category category;
    private final int needed;
    private final int available;

    public CapacityExceededException(Category category, int needed, int available) {
        super("Capacity exceeded for %s: needs %d drawer(s), %d available"
            .formatted(Objects.requireNonNull(category, "category").key(), needed, available));
        this.category = category;
        this.needed = needed;
        this.available = available;
    }

    public Category category() {
        return category;
    }

    public int needed() {
        return needed;
    }

    public int available() {
        return available;
    }

    public StorageIssue toIssue() {
        return StorageIssue.of(IssueType.CAPACITY_EXCEEDED, category.key(), getMessage());
    }
}
