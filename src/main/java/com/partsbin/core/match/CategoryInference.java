package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.core.value.ComponentValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Guesses the category of a free-text label: keyword cues first, then the notation of the value itself.
 */
public final class CategoryInference {

    private static final Map<Category, List<String>> KEYWORDS = keywordTable();

    private static final List<String> LED_COLORS = List.of(
        "red", "green", "blue", "yellow", "white", "orange", "amber", "purple", "pink", "uv", "warm white", "rgb");

    private static final Pattern DIODE_PART = Pattern.compile("^(1N\\d{3,4}[A-Z]?|BAT\\d+|OA\\d+|1S\\d+|BZX\\S*|D9\\S*)$");
    private static final Pattern TRANSISTOR_PART = Pattern.compile(
        "^(2N\\d{3,4}[A-Z]?|2S[ABCJK]\\d+\\S*|BC\\d{3}[A-Z]?|BS\\d{3}|MPSA\\d+|J\\d{3}|MMBF\\S+|IRF\\S+|AC\\d{3}|NKT\\S+)$");
    private static final Pattern IC_PART = Pattern.compile(
        "^(TL\\d{2,3}\\S*|NE\\d{3}\\S*|LM\\d{2,4}\\S*|PT\\d{4}\\S*|JRC\\S+|RC\\d{4}\\S*|CD4\\d+\\S*|74\\S+|MAX\\d+\\S*"
            + "|TC\\d{4}\\S*|ICL\\d+\\S*|LT\\d+\\S*|OPA\\d+\\S*|NJM\\S+|FV-?1|24LC\\S*|78L?\\d{2}\\S*|79L?\\d{2}\\S*|MN\\d{4}\\S*"
            + "|V\\d{4}\\S*|LF\\d{3}\\S*|CA\\d{4}\\S*)$");
    private static final Pattern POT_VALUE = Pattern.compile("^[ABCW]\\d+(?:\\.\\d+)?[KM]$");

    private CategoryInference() {
    }

    public static Optional<Category> infer(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<Category> byKeyword = byKeyword(text);
        if (byKeyword.isPresent()) {
            return byKeyword;
        }
        return byNotation(text);
    }

    static Optional<Category> byKeyword(String text) {
        String padded = " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9/-]+", " ") + " ";
        for (Map.Entry<Category, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (padded.contains(" " + keyword + " ")) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    static Optional<Category> byNotation(String text) {
        String[] tokens = text.trim().toUpperCase(Locale.ROOT).split("\\s+");
        for (String token : tokens) {
            if (DIODE_PART.matcher(token).matches()) {
                return Optional.of(Category.DIODE);
            }
            if (TRANSISTOR_PART.matcher(token).matches()) {
                return Optional.of(Category.TRANSISTOR);
            }
            if (IC_PART.matcher(token).matches()) {
                return Optional.of(Category.IC);
            }
        }
        for (String token : tokens) {
            if (POT_VALUE.matcher(token).matches()) {
                return Optional.of(Category.POTENTIOMETER);
            }
        }
        String lower = " " + text.toLowerCase(Locale.ROOT) + " ";
        for (String color : LED_COLORS) {
            if (lower.contains(" " + color + " ")) {
                return Optional.of(Category.LED);
            }
        }
        if (ComponentValues.parseCapacitance(text).isPresent()) {
            return Optional.of(Category.CAPACITOR);
        }
        for (String token : tokens) {
            if (ComponentValues.parseCapacitance(token).isPresent()) {
                return Optional.of(Category.CAPACITOR);
            }
        }
        if (ComponentValues.parseResistance(text).isPresent()) {
            return Optional.of(Category.RESISTOR);
        }
        for (String token : tokens) {
            if (ComponentValues.parseResistance(token).isPresent()) {
                return Optional.of(Category.RESISTOR);
            }
        }
        return Optional.empty();
    }

    private static Map<Category, List<String>> keywordTable() {
        // checked in insertion order: "LED diode" is an LED, "metal film resistor" a resistor,
        // "germanium transistor" a transistor
        Map<Category, List<String>> table = new LinkedHashMap<>();
        table.put(Category.LED, List.of("led", "leds"));
        table.put(Category.POTENTIOMETER, List.of("pot", "pots", "potentiometer", "potentiometers", "trimmer", "trimpot"));
        table.put(Category.RESISTOR, List.of("resistor", "resistors", "ohm", "ohms"));
        table.put(Category.CAPACITOR, List.of("capacitor", "capacitors", "cap", "caps", "ceramic", "electrolytic", "mlcc", "film"));
        table.put(Category.TRANSISTOR, List.of("transistor", "transistors", "npn", "pnp", "jfet", "mosfet"));
        table.put(Category.DIODE, List.of("diode", "diodes", "zener", "schottky", "rectifier", "germanium"));
        table.put(Category.IC, List.of("ic", "op-amp", "opamp", "chip", "regulator", "eeprom", "dsp", "charge pump", "hex inverter"));
        return table;
    }
}
