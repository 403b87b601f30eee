package com.partsbin.core.picking;

import java.util.Objects;

/**
 * One bill-of-materials line.
 *
 * @param reference reference designator such as {@code R1}, may be empty
 * @param name      free-text component name
 * @param quantity  required quantity, at least 1
 */
public record BomLine(String reference, String name, int quantity) {

    public BomLine {
        reference = reference == null ? "" : reference.trim();
        Objects.requireNonNull(name, "name");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("BOM line needs a component name");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("BOM quantity must be positive for %s: %d".formatted(name, quantity));
        }
    }
}
