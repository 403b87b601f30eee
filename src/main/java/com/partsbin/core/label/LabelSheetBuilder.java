package com.partsbin.core.label;

import com.partsbin.core.location.LocationMap;
import com.partsbin.core.match.QualifierRules;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the location map into label cells, drawers in physical order. Each drawer gets one front
 * label ({@code R: 1K  |  2.2K  |  4.7K}) followed by one cell per occupied compartment.
 */
public final class LabelSheetBuilder {

    static final String VALUE_SEPARATOR = "  |  ";

    private final QualifierRules rules;

    public LabelSheetBuilder() {
        this(QualifierRules.defaults());
    }

    public LabelSheetBuilder(QualifierRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public List<LabelCell> build(LocationMap locations) {
        Objects.requireNonNull(locations, "locations");
        Map<StorageSlot, ComponentIdentity> bySlot = new TreeMap<>(StorageSlot.PHYSICAL_ORDER);
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : locations.entries().entrySet()) {
            for (StorageSlot slot : entry.getValue()) {
                bySlot.put(slot, entry.getKey());
            }
        }

        List<LabelCell> cells = new ArrayList<>();
        String currentDrawer = null;
        List<Map.Entry<StorageSlot, ComponentIdentity>> drawerSlots = new ArrayList<>();
        for (Map.Entry<StorageSlot, ComponentIdentity> entry : bySlot.entrySet()) {
            String drawerKey = entry.getKey().drawerKey();
            if (currentDrawer != null && !currentDrawer.equals(drawerKey)) {
                emitDrawer(drawerSlots, cells);
                drawerSlots.clear();
            }
            currentDrawer = drawerKey;
            drawerSlots.add(entry);
        }
        if (!drawerSlots.isEmpty()) {
            emitDrawer(drawerSlots, cells);
        }
        return cells;
    }

    private void emitDrawer(List<Map.Entry<StorageSlot, ComponentIdentity>> slots, List<LabelCell> cells) {
        StorageSlot first = slots.get(0).getKey();
        Set<String> prefixes = new LinkedHashSet<>();
        List<String> values = new ArrayList<>();
        for (Map.Entry<StorageSlot, ComponentIdentity> entry : slots) {
            ComponentIdentity identity = entry.getValue();
            prefixes.add(rules.labelPrefix(identity.category(), identity.subtype()));
            values.add(rules.abbreviate(identity));
        }
        // a drawer normally holds one partition; mixed drawers list every prefix
        String prefix = String.join(" / ", prefixes);
        cells.add(new LabelCell(first.unit(), first.drawer(), null, prefix + ": " + String.join(VALUE_SEPARATOR, values)));
        for (Map.Entry<StorageSlot, ComponentIdentity> entry : slots) {
            StorageSlot slot = entry.getKey();
            if (slot.compartment() != null) {
                cells.add(new LabelCell(slot.unit(), slot.drawer(), slot.compartment(), rules.abbreviate(entry.getValue())));
            }
        }
    }
}
