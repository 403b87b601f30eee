package com.partsbin.core.catalog;

/**
 * One component row as the inventory system reports it. Fields are raw and may be missing;
 * validation happens during the merge.
 *
 * @param category    category name or path, e.g. {@code Resistors} or {@code Passives/Capacitors}
 * @param subtype     subtype, may be blank
 * @param value       value or part number as written
 * @param quantity    stock on hand, {@code null} when not reported
 * @param minQuantity reorder threshold, {@code null} when not reported
 */
public record InventoryRecord(String category, String subtype, String value, Integer quantity, Integer minQuantity) {

    public String describe() {
        return "inventory %s/%s/%s".formatted(category, subtype == null ? "" : subtype, value);
    }
}
