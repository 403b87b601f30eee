package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declarative per-category table of qualifier words and label prefixes.
 * <p>
 * Qualifiers are the words a catalog or BOM adds around a value ("Silicon", "NPN", "Dual Op-Amp")
 * that carry no identity of their own once the category is known. The matcher strips them before
 * scoring and the label builder strips them to keep drawer labels short.
 */
public final class QualifierRules {

    private static final QualifierRules DEFAULTS = builder()
        .category(Category.RESISTOR, "R", "resistor", "resistors", "res", "ohm", "ohms", "1/4w", "1/4 w", "metal film", "carbon film")
        .category(Category.CAPACITOR, "Caps", "capacitor", "capacitors", "cap", "caps")
        .subtypeQualifiers(Category.CAPACITOR, "ceramic", "cer", "mlcc", "film", "box", "electrolytic", "elect", "elec")
        .subtypePrefix(Category.CAPACITOR, "ceramic", "Caps Cer")
        .subtypePrefix(Category.CAPACITOR, "film", "Caps Film")
        .subtypePrefix(Category.CAPACITOR, "electrolytic", "Caps Elect")
        .category(Category.DIODE, "Diodes",
            "zener diode", "germanium diode", "rectifier", "germanium", "silicon", "schottky", "zener", "diode", "diodes")
        .category(Category.TRANSISTOR, "Q", "transistor", "transistors")
        .subtypeQualifiers(Category.TRANSISTOR, "npn", "pnp", "jfet", "mosfet")
        .subtypePrefix(Category.TRANSISTOR, "NPN", "Q NPN")
        .subtypePrefix(Category.TRANSISTOR, "PNP", "Q PNP")
        .subtypePrefix(Category.TRANSISTOR, "JFET", "Q JFET")
        .subtypePrefix(Category.TRANSISTOR, "MOSFET", "Q MOSFET")
        .category(Category.IC, "IC",
            "dual op-amp", "quad op-amp", "single op-amp", "op-amp", "opamp", "charge pump", "regulator",
            "audio amp", "hex inverter", "delay", "eeprom", "dsp", "ic", "chip")
        .category(Category.POTENTIOMETER, "Pots", "potentiometer", "potentiometers", "pot", "pots")
        .subtypeQualifiers(Category.POTENTIOMETER, "audio", "log", "linear", "lin", "trimmer", "trimpot", "trim")
        .category(Category.LED, "LEDs", "led", "leds")
        .subtypeQualifiers(Category.LED, "3mm", "5mm", "10mm")
        .build();

    private final Map<Category, Rule> rules;

    private QualifierRules(Map<Category, Rule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static QualifierRules defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Removes category and subtype qualifier words (whole words, case-insensitive) and collapses whitespace.
     */
    public String strip(Category category, String text) {
        Objects.requireNonNull(category, "category");
        if (text == null || text.isBlank()) {
            return "";
        }
        Rule rule = rules.get(category);
        String result = text;
        if (rule != null) {
            for (Pattern pattern : rule.patterns()) {
                result = pattern.matcher(result).replaceAll(" ");
            }
        }
        return result.trim().replaceAll("\\s+", " ");
    }

    /**
     * Strips only the words that describe a subtype, returning the subtype found in the text if any.
     */
    public String detectSubtype(Category category, String text) {
        if (text == null || text.isBlank() || !category.hasSubtypes()) {
            return "";
        }
        Rule rule = rules.get(category);
        if (rule == null) {
            return "";
        }
        String lower = " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9/-]+", " ") + " ";
        for (String word : rule.subtypeWords()) {
            if (lower.contains(" " + word + " ")) {
                return category.normalizeSubtype(word);
            }
        }
        return "";
    }

    /**
     * Label prefix for a drawer holding identities of the given category and subtype.
     */
    public String labelPrefix(Category category, String subtype) {
        Rule rule = rules.get(category);
        if (rule == null) {
            return category.key().toUpperCase(Locale.ROOT);
        }
        if (subtype != null && !subtype.isEmpty()) {
            String specific = rule.subtypePrefixes().get(subtype.toLowerCase(Locale.ROOT));
            if (specific != null) {
                return specific;
            }
            if (category == Category.LED) {
                return rule.prefix() + " " + subtype;
            }
        }
        return rule.prefix();
    }

    /**
     * Short display of one identity for a compartment label.
     */
    public String abbreviate(ComponentIdentity identity) {
        String stripped = strip(identity.category(), identity.value());
        String value = stripped.isEmpty() ? identity.value() : stripped;
        if (identity.category() == Category.POTENTIOMETER && !identity.subtype().isEmpty()) {
            return "TRIM".equals(identity.subtype()) ? value + " trim" : identity.subtype() + value;
        }
        return value;
    }

    private record Rule(String prefix,
                        List<Pattern> patterns,
                        List<String> subtypeWords,
                        Map<String, String> subtypePrefixes) {
    }

    public static final class Builder {
        private final Map<Category, String> prefixes = new EnumMap<>(Category.class);
        private final Map<Category, List<String>> words = new EnumMap<>(Category.class);
        private final Map<Category, List<String>> subtypeWords = new EnumMap<>(Category.class);
        private final Map<Category, Map<String, String>> subtypePrefixes = new EnumMap<>(Category.class);

        private Builder() {
        }

        public Builder category(Category category, String labelPrefix, String... qualifiers) {
            prefixes.put(category, Objects.requireNonNull(labelPrefix, "labelPrefix"));
            words.computeIfAbsent(category, ignored -> new ArrayList<>()).addAll(List.of(qualifiers));
            return this;
        }

        public Builder subtypeQualifiers(Category category, String... qualifiers) {
            subtypeWords.computeIfAbsent(category, ignored -> new ArrayList<>()).addAll(List.of(qualifiers));
            return this;
        }

        public Builder subtypePrefix(Category category, String subtype, String labelPrefix) {
            subtypePrefixes.computeIfAbsent(category, ignored -> new LinkedHashMap<>())
                .put(subtype.toLowerCase(Locale.ROOT), labelPrefix);
            return this;
        }

        public QualifierRules build() {
            Map<Category, Rule> rules = new EnumMap<>(Category.class);
            for (Map.Entry<Category, String> entry : prefixes.entrySet()) {
                Category category = entry.getKey();
                List<String> subtypes = subtypeWords.getOrDefault(category, List.of());
                List<String> all = new ArrayList<>(words.getOrDefault(category, List.of()));
                all.addAll(subtypes);
                // longest first so "dual op-amp" wins over "op-amp"
                all.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
                List<Pattern> patterns = new ArrayList<>(all.size());
                for (String word : all) {
                    patterns.add(Pattern.compile("(?<![\\p{Alnum}])" + Pattern.quote(word) + "(?![\\p{Alnum}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
                }
                List<String> orderedSubtypes = new ArrayList<>(subtypes);
                orderedSubtypes.replaceAll(word -> word.toLowerCase(Locale.ROOT));
                rules.put(category, new Rule(entry.getValue(),
                    List.copyOf(patterns),
                    List.copyOf(orderedSubtypes),
                    Map.copyOf(subtypePrefixes.getOrDefault(category, Map.of()))));
            }
            return new QualifierRules(rules);
        }
    }
}
