package com.partsbin.core.allocation;

import com.partsbin.core.issue.CapacityExceededException;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.model.SizeClass;
import com.partsbin.core.model.StorageSlot;
import com.partsbin.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Assigns storage slots to component types.
 * <p>
 * The result depends only on the specs, the topology and the prior map. Identities already in the
 * prior map keep their slots; new identities are grouped per category and placed into drawers no
 * prior entry occupies, one drawer per chunk, compartments filled front-left to back-right. A
 * category whose free drawers cannot hold all its new chunks places nothing and is reported; the
 * other categories are unaffected.
 */
public final class AllocationEngine {

    private static final Logger LOGGER = AppLogger.get();

    private final GroupingRules groupingRules;

    public AllocationEngine() {
        this(GroupingRules.defaults());
    }

    public AllocationEngine(GroupingRules groupingRules) {
        this.groupingRules = Objects.requireNonNull(groupingRules, "groupingRules");
    }

    public AllocationResult allocate(Collection<ComponentSpec> specs, AllocationTopology topology, LocationMap prior) {
        Objects.requireNonNull(specs, "specs");
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(prior, "prior");

        Map<Category, List<ComponentSpec>> pending = new EnumMap<>(Category.class);
        Set<ComponentIdentity> seen = new HashSet<>();
        for (ComponentSpec spec : specs) {
            if (!seen.add(spec.identity())) {
                throw new IllegalArgumentException("Duplicate spec for " + spec.identity().key());
            }
            if (!prior.contains(spec.identity())) {
                pending.computeIfAbsent(spec.category(), ignored -> new ArrayList<>()).add(spec);
            }
        }

        Set<String> consumed = prior.occupiedDrawerKeys();
        Map<ComponentIdentity, List<StorageSlot>> added = new TreeMap<>();
        List<StorageIssue> issues = new ArrayList<>();
        for (Map.Entry<Category, List<ComponentSpec>> entry : pending.entrySet()) {
            Category category = entry.getKey();
            List<ComponentGroup> groups = groupingRules.group(category, entry.getValue());
            List<AllocationTopology.Drawer> free = new ArrayList<>();
            for (AllocationTopology.Drawer drawer : topology.drawers(category)) {
                if (!consumed.contains(drawer.key())) {
                    free.add(drawer);
                }
            }
            try {
                Map<ComponentIdentity, StorageSlot> placed = place(category, groups, free);
                placed.forEach((identity, slot) -> {
                    added.put(identity, List.of(slot));
                    consumed.add(slot.drawerKey());
                });
                LOGGER.info("Placed %d new %s type(s)".formatted(placed.size(), category.key()));
            } catch (CapacityExceededException ex) {
                LOGGER.warning(ex.getMessage());
                issues.add(ex.toIssue());
            }
        }

        LocationMap extended = prior.extendedWith(added);
        if (!issues.isEmpty()) {
            LOGGER.warning("Allocation finished with %d issue(s)".formatted(issues.size()));
        }
        return new AllocationResult(extended, added, issues);
    }

    /**
     * Places every group of one category or nothing at all.
     */
    private Map<ComponentIdentity, StorageSlot> place(Category category,
                                                      List<ComponentGroup> groups,
                                                      List<AllocationTopology.Drawer> free) throws CapacityExceededException {
        int needed = drawersNeeded(groups, free);
        if (needed > free.size()) {
            throw new CapacityExceededException(category, needed, free.size());
        }
        Map<ComponentIdentity, StorageSlot> placed = new LinkedHashMap<>();
        int next = 0;
        for (ComponentGroup group : groups) {
            List<ComponentSpec> members = group.members();
            int index = 0;
            while (index < members.size()) {
                AllocationTopology.Drawer drawer = free.get(next++);
                int chunk = Math.min(drawer.capacity(), members.size() - index);
                for (int position = 0; position < chunk; position++) {
                    ComponentSpec spec = members.get(index + position);
                    placed.put(spec.identity(), slot(drawer, position + 1));
                }
                index += chunk;
            }
        }
        return placed;
    }

    /**
     * Drawers the groups consume when placed in order. Past the end of the free list every further
     * drawer is assumed to hold a full compartment set.
     */
    static int drawersNeeded(List<ComponentGroup> groups, List<AllocationTopology.Drawer> free) {
        int used = 0;
        for (ComponentGroup group : groups) {
            int remaining = group.size();
            while (remaining > 0) {
                int capacity = used < free.size() ? free.get(used).capacity() : SizeClass.COMPARTMENTS;
                remaining -= Math.min(capacity, remaining);
                used++;
            }
        }
        return used;
    }

    private static StorageSlot slot(AllocationTopology.Drawer drawer, int compartment) {
        if (drawer.sizeClass().compartmentalized()) {
            return StorageSlot.compartment(drawer.unit(), drawer.drawer(), drawer.sizeClass(), compartment);
        }
        return StorageSlot.whole(drawer.unit(), drawer.drawer(), drawer.sizeClass());
    }
}
