package com.partsbin.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One physical storage location: a compartment of a small or medium drawer, or a whole large or tall drawer.
 *
 * @param unit        cabinet id, e.g. {@code U1}
 * @param drawer      drawer id within the unit, e.g. {@code S5}
 * @param sizeClass   drawer size class
 * @param compartment compartment index 1..4, or {@code null} for single-slot drawers
 */
public record StorageSlot(String unit, String drawer, SizeClass sizeClass, Integer compartment) {

    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern DISPLAY = Pattern.compile("^([A-Za-z]*\\d+)-([A-Za-z]+\\d+)(?:-(\\d+))?$");

    /**
     * Physical walking order: unit number, drawer number, drawer id, compartment.
     */
    public static final Comparator<StorageSlot> PHYSICAL_ORDER = Comparator
        .comparingInt((StorageSlot slot) -> number(slot.unit()))
        .thenComparing(StorageSlot::unit)
        .thenComparingInt(StorageSlot::drawerNumber)
        .thenComparing(StorageSlot::drawer)
        .thenComparingInt(StorageSlot::compartmentOrZero);

    public StorageSlot {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(drawer, "drawer");
        Objects.requireNonNull(sizeClass, "sizeClass");
        unit = unit.trim().toUpperCase(Locale.ROOT);
        drawer = drawer.trim().toUpperCase(Locale.ROOT);
        if (unit.isEmpty() || drawer.isEmpty()) {
            throw new IllegalArgumentException("Unit and drawer must not be blank");
        }
        if (sizeClass.compartmentalized()) {
            if (compartment == null) {
                throw new IllegalArgumentException("Drawer %s-%s (%s) needs a compartment index"
                    .formatted(unit, drawer, sizeClass));
            }
            if (compartment < 1 || compartment > SizeClass.COMPARTMENTS) {
                throw new IllegalArgumentException("Compartment %d out of range 1..%d for %s-%s"
                    .formatted(compartment, SizeClass.COMPARTMENTS, unit, drawer));
            }
        } else if (compartment != null) {
            throw new IllegalArgumentException("Drawer %s-%s (%s) has no compartments"
                .formatted(unit, drawer, sizeClass));
        }
    }

    public static StorageSlot compartment(String unit, String drawer, SizeClass sizeClass, int compartment) {
        return new StorageSlot(unit, drawer, sizeClass, compartment);
    }

    public static StorageSlot whole(String unit, String drawer, SizeClass sizeClass) {
        return new StorageSlot(unit, drawer, sizeClass, null);
    }

    /**
     * Parses the display form ({@code U1-S5-1}, {@code U2-L1}); the size class comes from the drawer prefix.
     */
    public static StorageSlot parse(String display) {
        Objects.requireNonNull(display, "display");
        Matcher matcher = DISPLAY.matcher(display.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a storage slot: " + display);
        }
        String drawer = matcher.group(2);
        SizeClass sizeClass = SizeClass.fromDrawerId(drawer)
            .orElseThrow(() -> new IllegalArgumentException("Unknown drawer prefix in " + display));
        Integer compartment = matcher.group(3) == null ? null : Integer.parseInt(matcher.group(3));
        return new StorageSlot(matcher.group(1), drawer, sizeClass, compartment);
    }

    public int drawerNumber() {
        return number(drawer);
    }

    /**
     * Identifies the drawer this slot belongs to, independent of the compartment.
     */
    public String drawerKey() {
        return unit + "-" + drawer;
    }

    public String display() {
        return compartment == null ? drawerKey() : drawerKey() + "-" + compartment;
    }

    /**
     * Physical position name of the compartment, empty for single-slot drawers.
     */
    public String positionName() {
        if (compartment == null) {
            return "";
        }
        return switch (compartment) {
            case 1 -> "Front-Left";
            case 2 -> "Front-Right";
            case 3 -> "Back-Left";
            default -> "Back-Right";
        };
    }

    private int compartmentOrZero() {
        return compartment == null ? 0 : compartment;
    }

    private static int number(String id) {
        Matcher matcher = DIGITS.matcher(id);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    @Override
    public String toString() {
        return display();
    }
}
