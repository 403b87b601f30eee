package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.value.ComponentValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reduces labels and identities to the comparable text the scorer sees: qualifiers stripped,
 * value notation canonical, lower case, single spaces.
 */
public final class NameNormalizer {

    private final QualifierRules rules;

    public NameNormalizer(QualifierRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public String normalize(Category category, String text) {
        Objects.requireNonNull(category, "category");
        String stripped = rules.strip(category, text);
        if (stripped.isEmpty()) {
            return "";
        }
        String whole = canonicalIfParsed(category, stripped);
        if (whole != null) {
            return whole.toLowerCase(Locale.ROOT);
        }
        List<String> tokens = new ArrayList<>();
        for (String token : stripped.split(" ")) {
            String canonical = canonicalIfParsed(category, token);
            tokens.add(canonical != null ? canonical : token);
        }
        return String.join(" ", tokens).toLowerCase(Locale.ROOT);
    }

    public String normalize(ComponentIdentity identity) {
        return normalize(identity.category(), identity.value());
    }

    /**
     * Subtype named by the label, empty when it names none.
     */
    public String subtypeOf(Category category, String text) {
        return rules.detectSubtype(category, text);
    }

    private static String canonicalIfParsed(Category category, String text) {
        boolean parses = switch (category) {
            case RESISTOR, POTENTIOMETER -> ComponentValues.parseResistance(text).isPresent();
            case CAPACITOR -> ComponentValues.parseCapacitance(text).isPresent();
            default -> false;
        };
        return parses ? ComponentValues.canonical(category, text) : null;
    }
}
