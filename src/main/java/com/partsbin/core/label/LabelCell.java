package com.partsbin.core.label;

import java.util.Objects;

/**
 * Printable text for a drawer front ({@code compartment == null}) or for one compartment.
 */
public record LabelCell(String unit, String drawer, Integer compartment, String text) {

    public LabelCell {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(drawer, "drawer");
        text = text == null ? "" : text;
    }

    public boolean drawerLevel() {
        return compartment == null;
    }
}
