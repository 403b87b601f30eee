package com.partsbin.core.picking;

import com.partsbin.core.model.StorageSlot;

import java.util.List;
import java.util.Optional;

/**
 * Entries picked from one slot, in BOM order. The trailing group without a slot holds every
 * unlocated or unmatched line.
 */
public record PickGroup(StorageSlot slot, List<PickListEntry> entries) {

    public static final String LOCATION_NOT_SET = "Location Not Set";

    public PickGroup {
        entries = List.copyOf(entries);
    }

    public Optional<StorageSlot> location() {
        return Optional.ofNullable(slot);
    }

    public boolean unlocated() {
        return slot == null;
    }

    public String label() {
        if (slot == null) {
            return LOCATION_NOT_SET;
        }
        String position = slot.positionName();
        return position.isEmpty() ? slot.display() : slot.display() + " (" + position + ")";
    }
}
