package com.partsbin.core.model;

import com.partsbin.core.value.ComponentValues;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The (category, subtype, value) tuple that names one component type.
 *
 * @param category component family
 * @param subtype  canonical subtype, empty when the category has none or it is unknown
 * @param value    canonical value display, e.g. {@code 4.7K}, {@code 100nF}, {@code TL072}
 */
public record ComponentIdentity(Category category, String subtype, String value) implements Comparable<ComponentIdentity> {

    public static final Comparator<ComponentIdentity> BY_KEY = Comparator.comparing(ComponentIdentity::key);

    private static final Pattern TAPERED_POT = Pattern.compile("^([ABCW])\\s*(\\d.*)$", Pattern.CASE_INSENSITIVE);

    public ComponentIdentity {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(value, "value");
        subtype = subtype == null ? "" : subtype;
        if (value.isBlank()) {
            throw new IllegalArgumentException("Component value must not be blank");
        }
    }

    /**
     * Builds an identity from raw source text, canonicalizing subtype spelling and value notation.
     */
    public static ComponentIdentity of(Category category, String rawSubtype, String rawValue) {
        Objects.requireNonNull(category, "category");
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("Component value must not be blank");
        }
        String subtype = category.normalizeSubtype(rawSubtype);
        String value = rawValue.trim();
        if (category == Category.POTENTIOMETER && subtype.isEmpty()) {
            Matcher matcher = TAPERED_POT.matcher(value);
            if (matcher.matches()) {
                subtype = category.normalizeSubtype(matcher.group(1));
                value = matcher.group(2);
            }
        }
        return new ComponentIdentity(category, subtype, ComponentValues.canonical(category, value));
    }

    /**
     * Stable textual key, {@code category:subtype:value}. Used as the persisted map key.
     */
    public String key() {
        return category.key() + ":" + subtype + ":" + value;
    }

    public static ComponentIdentity parseKey(String key) {
        Objects.requireNonNull(key, "key");
        String[] parts = key.split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed identity key: " + key);
        }
        Category category = Category.fromName(parts[0])
            .orElseThrow(() -> new IllegalArgumentException("Unknown category in identity key: " + key));
        return new ComponentIdentity(category, parts[1], parts[2]);
    }

    /**
     * Human readable form used on reports, e.g. {@code 100nF ceramic capacitor} or {@code 4.7K resistor}.
     */
    public String displayName() {
        StringBuilder builder = new StringBuilder(value);
        if (!subtype.isEmpty()) {
            builder.append(' ').append(subtype);
        }
        return builder.append(' ').append(category.key()).toString();
    }

    @Override
    public int compareTo(ComponentIdentity other) {
        return BY_KEY.compare(this, other);
    }

    @Override
    public String toString() {
        return key();
    }
}
