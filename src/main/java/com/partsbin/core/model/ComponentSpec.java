package com.partsbin.core.model;

import java.util.Objects;

/**
 * Merged view of one component type: what it is, how often it is used and how much is on hand.
 *
 * @param identity       canonical identity
 * @param usageCount     relative usage from the reference dataset (0 when unknown)
 * @param priority       essential or optional
 * @param quantityOnHand stock reported by the inventory system (0 for reference-only entries)
 * @param minQuantity    reorder threshold reported by the inventory system
 */
public record ComponentSpec(ComponentIdentity identity,
                            int usageCount,
                            Priority priority,
                            int quantityOnHand,
                            int minQuantity) {

    public ComponentSpec {
        Objects.requireNonNull(identity, "identity");
        priority = priority == null ? Priority.OPTIONAL : priority;
        if (quantityOnHand < 0 || minQuantity < 0 || usageCount < 0) {
            throw new IllegalArgumentException("Negative counts for " + identity.key());
        }
    }

    public static ComponentSpec referenceOnly(ComponentIdentity identity, int usageCount, Priority priority) {
        return new ComponentSpec(identity, usageCount, priority, 0, 0);
    }

    public Category category() {
        return identity.category();
    }

    public boolean belowMinimum() {
        return quantityOnHand < minQuantity;
    }
}
