package com.partsbin.core.picking;

import java.util.List;

/**
 * Totals of a picking sheet.
 *
 * @param totalLineItems  BOM lines on the sheet
 * @param uniqueLocations distinct slots to visit (unlocated lines not counted)
 * @param itemsInStock    lines whose stock covers the required quantity
 * @param shortages       lines that cannot be picked in full, in walking order
 * @param unmatched       BOM names that matched no identity
 * @param unlocated       BOM names whose identity has no slot
 */
public record PickingSummary(int totalLineItems,
                             int uniqueLocations,
                             int itemsInStock,
                             List<ShortageItem> shortages,
                             List<String> unmatched,
                             List<String> unlocated) {

    public PickingSummary {
        shortages = List.copyOf(shortages);
        unmatched = List.copyOf(unmatched);
        unlocated = List.copyOf(unlocated);
    }

    public int itemsShort() {
        return shortages.size();
    }
}
