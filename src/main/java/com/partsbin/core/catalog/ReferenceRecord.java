package com.partsbin.core.catalog;

/**
 * One entry of the reference dataset: a commonly used value and how important it is to stock.
 *
 * @param category   category name as written in the dataset
 * @param subtype    subtype, blank when the dataset does not name one
 * @param value      value or part number as written
 * @param usageCount relative usage, {@code null} when not given
 * @param priority   {@code essential} or {@code optional}, {@code null} when not given
 */
public record ReferenceRecord(String category, String subtype, String value, Integer usageCount, String priority) {

    public String describe() {
        return "reference %s/%s/%s".formatted(category, subtype == null ? "" : subtype, value);
    }
}
