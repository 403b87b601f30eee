package com.partsbin.core.allocation;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentSpec;

import java.util.List;
import java.util.Objects;

/**
 * One partition of a category, members already in placement order. Members of a partition are
 * split into drawer-sized chunks during placement; two partitions never share a drawer.
 *
 * @param category  category of every member
 * @param partition partition label, e.g. {@code 1K-10K}, {@code ceramic}, or empty for single-pool categories
 * @param members   specs in placement order
 */
public record ComponentGroup(Category category, String partition, List<ComponentSpec> members) {

    public ComponentGroup {
        Objects.requireNonNull(category, "category");
        partition = partition == null ? "" : partition;
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
