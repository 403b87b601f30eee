package com.partsbin.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Drawer size classes. Small and medium drawers are split into four compartments,
 * large and tall drawers hold a single item.
 */
public enum SizeClass {
    SMALL('S', true),
    MEDIUM('M', true),
    LARGE('L', false),
    TALL('T', false);

    public static final int COMPARTMENTS = 4;

    private final char drawerPrefix;
    private final boolean compartmentalized;

    SizeClass(char drawerPrefix, boolean compartmentalized) {
        this.drawerPrefix = drawerPrefix;
        this.compartmentalized = compartmentalized;
    }

    public boolean compartmentalized() {
        return compartmentalized;
    }

    public int capacity() {
        return compartmentalized ? COMPARTMENTS : 1;
    }

    public char drawerPrefix() {
        return drawerPrefix;
    }

    public static SizeClass fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Size class is required");
        }
        return SizeClass.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Infers the size class from the drawer id prefix ({@code S5}, {@code M12}, {@code L1}, {@code T3}).
     */
    public static Optional<SizeClass> fromDrawerId(String drawerId) {
        if (drawerId == null || drawerId.isBlank()) {
            return Optional.empty();
        }
        char prefix = Character.toUpperCase(drawerId.trim().charAt(0));
        for (SizeClass sizeClass : values()) {
            if (sizeClass.drawerPrefix == prefix) {
                return Optional.of(sizeClass);
            }
        }
        return Optional.empty();
    }
}
