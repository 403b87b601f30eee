package com.partsbin.core.allocation;

import com.partsbin.core.model.SizeClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A run of same-sized drawers in one unit, reserved for a category.
 *
 * @param unit      cabinet id
 * @param sizeClass size class shared by every drawer in the run
 * @param drawers   drawer ids in consumption order
 */
public record DrawerRange(String unit, SizeClass sizeClass, List<String> drawers) {

    private static final Pattern RANGE = Pattern.compile("^([A-Za-z]+)(\\d+)\\s*-\\s*([A-Za-z]*)(\\d+)$");

    public DrawerRange {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(sizeClass, "sizeClass");
        Objects.requireNonNull(drawers, "drawers");
        unit = unit.trim().toUpperCase(Locale.ROOT);
        if (unit.isEmpty()) {
            throw new IllegalArgumentException("Drawer range needs a unit");
        }
        if (drawers.isEmpty()) {
            throw new IllegalArgumentException("Drawer range in %s lists no drawers".formatted(unit));
        }
        List<String> normalized = new ArrayList<>(drawers.size());
        for (String drawer : drawers) {
            if (drawer == null || drawer.isBlank()) {
                throw new IllegalArgumentException("Blank drawer id in %s".formatted(unit));
            }
            normalized.add(drawer.trim().toUpperCase(Locale.ROOT));
        }
        drawers = List.copyOf(normalized);
    }

    /**
     * Expands a range such as {@code S1-S16} (or {@code S1-16}) into its drawer ids.
     */
    public static DrawerRange parse(String unit, SizeClass sizeClass, String spec) {
        Objects.requireNonNull(spec, "spec");
        Matcher matcher = RANGE.matcher(spec.trim());
        if (!matcher.matches()) {
            return new DrawerRange(unit, sizeClass, List.of(spec.trim()));
        }
        String prefix = matcher.group(1).toUpperCase(Locale.ROOT);
        String endPrefix = matcher.group(3).toUpperCase(Locale.ROOT);
        if (!endPrefix.isEmpty() && !endPrefix.equals(prefix)) {
            throw new IllegalArgumentException("Drawer range %s mixes prefixes".formatted(spec));
        }
        int start = Integer.parseInt(matcher.group(2));
        int end = Integer.parseInt(matcher.group(4));
        if (end < start) {
            throw new IllegalArgumentException("Drawer range %s runs backwards".formatted(spec));
        }
        List<String> drawers = new ArrayList<>(end - start + 1);
        for (int number = start; number <= end; number++) {
            drawers.add(prefix + number);
        }
        return new DrawerRange(unit, sizeClass, drawers);
    }
}
