package com.partsbin.core.picking;

import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;

import java.util.Objects;
import java.util.Optional;

/**
 * One BOM line resolved against the location map and stock.
 *
 * @param line       source BOM line
 * @param identity   resolved identity, {@code null} when the name could not be matched
 * @param slot       primary slot of the identity, {@code null} when it has no location
 * @param onHand     stock on hand, 0 for unresolved lines
 * @param confidence 1.0 for exact lookups, the match score for fuzzy ones, 0 when unresolved
 */
public record PickListEntry(BomLine line, ComponentIdentity identity, StorageSlot slot, int onHand, double confidence) {

    public PickListEntry {
        Objects.requireNonNull(line, "line");
        if (identity == null && slot != null) {
            throw new IllegalArgumentException("Unresolved line %s cannot have a slot".formatted(line.name()));
        }
        onHand = Math.max(0, onHand);
    }

    public int required() {
        return line.quantity();
    }

    public boolean resolved() {
        return identity != null;
    }

    public boolean located() {
        return slot != null;
    }

    public Optional<StorageSlot> location() {
        return Optional.ofNullable(slot);
    }

    public boolean sufficient() {
        return onHand >= required();
    }

    public int shortfall() {
        return Math.max(0, required() - onHand);
    }

    /**
     * Name shown on reports: the resolved identity, or the BOM text when unresolved.
     */
    public String displayName() {
        return identity == null ? line.name() : identity.displayName();
    }
}
