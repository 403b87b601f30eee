package com.partsbin.core.value;

import com.partsbin.core.model.Category;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses component value notation and renders the canonical display used in identities.
 */
public final class ComponentValues {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    // 4K7, 2R2, 1M5
    private static final Pattern RESISTANCE_RKM = Pattern.compile("^(\\d+)([RKM])(\\d+)$");
    private static final Pattern RESISTANCE = Pattern.compile("^(\\d+(?:\\.\\d+)?)([RKM]?)$");
    // 4u7, 2n2, 4p7; the tail is limited so part numbers such as 2N5088 are not read as values
    private static final Pattern CAPACITANCE_RKM = Pattern.compile("^(\\d+)([PNU])(\\d{1,2})$");
    private static final Pattern CAPACITANCE = Pattern.compile("^(\\d+(?:\\.\\d+)?)([PNU])F?$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final BigDecimal[] DECADE_BOUNDS = {
        BigDecimal.TEN,
        BigDecimal.valueOf(100),
        THOUSAND,
        BigDecimal.valueOf(10_000),
        BigDecimal.valueOf(100_000),
        MILLION
    };
    private static final String[] DECADE_NAMES = {
        "0.1-10", "10-100", "100-1K", "1K-10K", "10K-100K", "100K-1M", "1M+"
    };

    private ComponentValues() {
    }

    /**
     * Resistance in ohms for notations like {@code 4.7k}, {@code 4K7}, {@code 4.7 kΩ}, {@code 100R}, {@code 4700}.
     */
    public static Optional<BigDecimal> parseResistance(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = compact(raw)
            .replace("OHMS", "")
            .replace("OHM", "")
            .replace("Ω", "")
            .replace("Ω", "");
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher rkm = RESISTANCE_RKM.matcher(text);
        if (rkm.matches()) {
            BigDecimal base = new BigDecimal(rkm.group(1) + "." + rkm.group(3));
            return Optional.of(base.multiply(resistanceMultiplier(rkm.group(2))));
        }
        Matcher plain = RESISTANCE.matcher(text);
        if (plain.matches()) {
            return Optional.of(new BigDecimal(plain.group(1)).multiply(resistanceMultiplier(plain.group(2))));
        }
        return Optional.empty();
    }

    /**
     * Capacitance in picofarads for notations like {@code 100nF}, {@code 0.1uF}, {@code 0.1µF}, {@code 22p}, {@code 4u7}.
     */
    public static Optional<BigDecimal> parseCapacitance(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = compact(raw.replace('µ', 'u').replace('μ', 'u'));
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher rkm = CAPACITANCE_RKM.matcher(text);
        if (rkm.matches()) {
            BigDecimal base = new BigDecimal(rkm.group(1) + "." + rkm.group(3));
            return Optional.of(base.multiply(capacitanceMultiplier(rkm.group(2))));
        }
        Matcher plain = CAPACITANCE.matcher(text);
        if (plain.matches()) {
            return Optional.of(new BigDecimal(plain.group(1)).multiply(capacitanceMultiplier(plain.group(2))));
        }
        return Optional.empty();
    }

    public static String formatResistance(BigDecimal ohms) {
        if (ohms.compareTo(THOUSAND) < 0) {
            return plain(ohms) + "R";
        }
        if (ohms.compareTo(MILLION) < 0) {
            return plain(ohms.divide(THOUSAND, 6, RoundingMode.HALF_UP)) + "K";
        }
        return plain(ohms.divide(MILLION, 6, RoundingMode.HALF_UP)) + "M";
    }

    public static String formatCapacitance(BigDecimal picofarads) {
        if (picofarads.compareTo(THOUSAND) < 0) {
            return plain(picofarads) + "pF";
        }
        if (picofarads.compareTo(MILLION) < 0) {
            return plain(picofarads.divide(THOUSAND, 6, RoundingMode.HALF_UP)) + "nF";
        }
        return plain(picofarads.divide(MILLION, 6, RoundingMode.HALF_UP)) + "uF";
    }

    /**
     * Canonical display of a raw value for the given category. Values that do not parse are
     * kept as cleaned-up text so they still form a stable identity.
     */
    public static String canonical(Category category, String raw) {
        String cleaned = collapse(raw);
        return switch (category) {
            case RESISTOR -> parseResistance(cleaned).map(ComponentValues::formatResistance).orElse(cleaned.toUpperCase(Locale.ROOT));
            case CAPACITOR -> parseCapacitance(cleaned).map(ComponentValues::formatCapacitance).orElse(cleaned);
            case POTENTIOMETER -> parseResistance(cleaned)
                .map(ComponentValues::formatResistance)
                .map(ComponentValues::withoutOhmSuffix)
                .orElse(cleaned.toUpperCase(Locale.ROOT));
            case LED -> titleCase(cleaned);
            default -> cleaned.toUpperCase(Locale.ROOT);
        };
    }

    /**
     * Numeric magnitude used for ascending value sorts (ohms or picofarads), when the value parses.
     */
    public static Optional<BigDecimal> magnitude(Category category, String value) {
        return switch (category) {
            case RESISTOR, POTENTIOMETER -> parseResistance(value);
            case CAPACITOR -> parseCapacitance(value);
            default -> Optional.empty();
        };
    }

    /**
     * Logarithmic decade bucket: 0 = 0.1-10, 1 = 10-100, ... 6 = 1M and above.
     */
    public static int decade(BigDecimal ohms) {
        for (int i = 0; i < DECADE_BOUNDS.length; i++) {
            if (ohms.compareTo(DECADE_BOUNDS[i]) < 0) {
                return i;
            }
        }
        return DECADE_BOUNDS.length;
    }

    public static String decadeName(int decade) {
        return DECADE_NAMES[Math.max(0, Math.min(decade, DECADE_NAMES.length - 1))];
    }

    public static String collapse(String raw) {
        return raw == null ? "" : WHITESPACE.matcher(raw.trim()).replaceAll(" ");
    }

    private static String compact(String raw) {
        return WHITESPACE.matcher(raw.trim()).replaceAll("").toUpperCase(Locale.ROOT);
    }

    private static BigDecimal resistanceMultiplier(String suffix) {
        return switch (suffix) {
            case "K" -> THOUSAND;
            case "M" -> MILLION;
            default -> BigDecimal.ONE;
        };
    }

    private static BigDecimal capacitanceMultiplier(String suffix) {
        return switch (suffix) {
            case "N" -> THOUSAND;
            case "U" -> MILLION;
            default -> BigDecimal.ONE;
        };
    }

    private static String plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    private static String withoutOhmSuffix(String display) {
        return display.endsWith("R") ? display.substring(0, display.length() - 1) : display;
    }

    private static String titleCase(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        boolean start = true;
        for (char c : text.toCharArray()) {
            if (Character.isWhitespace(c) || c == '-') {
                start = true;
                builder.append(c);
            } else if (start) {
                builder.append(Character.toUpperCase(c));
                start = false;
            } else {
                builder.append(Character.toLowerCase(c));
            }
        }
        return builder.toString();
    }
}
