package com.partsbin.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Component families that own a reserved drawer range and their own grouping rule.
 */
public enum Category {
    RESISTOR("resistor", List.of()),
    CAPACITOR("capacitor", List.of("ceramic", "film", "electrolytic")),
    DIODE("diode", List.of()),
    TRANSISTOR("transistor", List.of("NPN", "PNP", "JFET", "MOSFET")),
    IC("ic", List.of()),
    POTENTIOMETER("potentiometer", List.of("A", "B", "C", "W", "TRIM")),
    LED("led", List.of("3mm", "5mm", "10mm"));

    private static final Map<String, Category> ALIASES = Map.ofEntries(
        Map.entry("resistor", RESISTOR),
        Map.entry("resistors", RESISTOR),
        Map.entry("capacitor", CAPACITOR),
        Map.entry("capacitors", CAPACITOR),
        Map.entry("cap", CAPACITOR),
        Map.entry("caps", CAPACITOR),
        Map.entry("diode", DIODE),
        Map.entry("diodes", DIODE),
        Map.entry("transistor", TRANSISTOR),
        Map.entry("transistors", TRANSISTOR),
        Map.entry("ic", IC),
        Map.entry("ics", IC),
        Map.entry("potentiometer", POTENTIOMETER),
        Map.entry("potentiometers", POTENTIOMETER),
        Map.entry("pot", POTENTIOMETER),
        Map.entry("pots", POTENTIOMETER),
        Map.entry("led", LED),
        Map.entry("leds", LED)
    );

    private static final Map<String, String> SUBTYPE_ALIASES = Map.ofEntries(
        Map.entry("mlcc", "ceramic"),
        Map.entry("cer", "ceramic"),
        Map.entry("box", "film"),
        Map.entry("elec", "electrolytic"),
        Map.entry("elect", "electrolytic"),
        Map.entry("electro", "electrolytic"),
        Map.entry("audio", "A"),
        Map.entry("audio_log", "A"),
        Map.entry("log", "A"),
        Map.entry("linear", "B"),
        Map.entry("lin", "B"),
        Map.entry("trim", "TRIM"),
        Map.entry("trimmer", "TRIM"),
        Map.entry("trimmers", "TRIM"),
        Map.entry("trimpot", "TRIM")
    );

    private final String key;
    private final List<String> subtypes;

    Category(String key, List<String> subtypes) {
        this.key = key;
        this.subtypes = subtypes;
    }

    public String key() {
        return key;
    }

    /**
     * Known subtypes in partition order. Empty for categories without a subtype axis.
     */
    public List<String> subtypes() {
        return subtypes;
    }

    public boolean hasSubtypes() {
        return !subtypes.isEmpty();
    }

    public static Optional<Category> fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        // inventory category paths look like "Passives/Resistors"
        int slash = normalized.lastIndexOf('/');
        if (slash >= 0) {
            normalized = normalized.substring(slash + 1).trim();
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }

    /**
     * Maps a raw subtype spelling onto the canonical spelling for this category.
     * Unknown subtypes are kept (trimmed) so they still form their own partition.
     */
    public String normalizeSubtype(String raw) {
        if (raw == null || raw.isBlank() || !hasSubtypes()) {
            return "";
        }
        String trimmed = raw.trim();
        String alias = SUBTYPE_ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        String candidate = alias != null ? alias : trimmed;
        for (String known : subtypes) {
            if (known.equalsIgnoreCase(candidate)) {
                return known;
            }
        }
        return candidate.toLowerCase(Locale.ROOT);
    }

    /**
     * Position of a subtype in partition order; unknown subtypes sort after the known ones.
     */
    public int subtypeRank(String subtype) {
        for (int i = 0; i < subtypes.size(); i++) {
            if (subtypes.get(i).equalsIgnoreCase(subtype)) {
                return i;
            }
        }
        return subtypes.size();
    }

    /**
     * Subtype assumed when a record omits it and nothing else disambiguates.
     */
    public String defaultSubtype() {
        return this == CAPACITOR ? "ceramic" : "";
    }
}
