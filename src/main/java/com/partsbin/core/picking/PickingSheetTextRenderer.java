package com.partsbin.core.picking;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Plain-text picking sheet. The output depends only on the sheet, so equal sheets render to equal bytes.
 */
public final class PickingSheetTextRenderer {

    static final String RULE = "=".repeat(70);
    static final String SEPARATOR = "-".repeat(70);
    static final String IN_STOCK = "in stock";
    static final String NEEDS_ORDERING = "needs ordering";

    public String render(PickingSheet sheet) {
        Objects.requireNonNull(sheet, "sheet");
        StringBuilder out = new StringBuilder();
        line(out, "PICKING SHEET: " + sheet.title());
        line(out, RULE);
        line(out, "Total BOM items: " + sheet.summary().totalLineItems());

        for (PickGroup group : sheet.groups()) {
            line(out, "");
            line(out, "LOCATION: " + group.label());
            line(out, SEPARATOR);
            for (PickListEntry entry : group.entries()) {
                line(out, entryLine(entry));
            }
        }

        PickingSummary summary = sheet.summary();
        line(out, "");
        line(out, RULE);
        line(out, "SUMMARY:");
        line(out, "  Total items to pick: " + summary.totalLineItems());
        line(out, "  Unique locations: " + summary.uniqueLocations());
        line(out, "  Items in stock: %d/%d".formatted(summary.itemsInStock(), summary.totalLineItems()));
        if (!summary.shortages().isEmpty()) {
            line(out, "");
            line(out, "  WARNING: %d item(s) need to be ordered!".formatted(summary.itemsShort()));
            line(out, "");
            line(out, "  Missing items:");
            for (ShortageItem item : summary.shortages()) {
                line(out, "    - %s: need %d more (have %d)".formatted(item.name(), item.shortfall(), item.onHand()));
            }
        }
        if (!summary.unmatched().isEmpty()) {
            line(out, "");
            line(out, "  Unmatched names (resolve by hand):");
            for (String name : summary.unmatched()) {
                line(out, "    - " + name);
            }
        }
        if (!summary.unlocated().isEmpty()) {
            line(out, "");
            line(out, "  Location not set:");
            for (String name : summary.unlocated()) {
                line(out, "    - " + name);
            }
        }
        line(out, "");
        line(out, "[ ] = pick | %s / %s".formatted(IN_STOCK, NEEDS_ORDERING));
        return out.toString();
    }

    public void write(PickingSheet sheet, Path target) throws IOException {
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(sheet), StandardCharsets.UTF_8);
    }

    static String entryLine(PickListEntry entry) {
        String quantity = entry.required() > 1 ? "(x" + entry.required() + ")" : "";
        String status = entry.sufficient() ? IN_STOCK : NEEDS_ORDERING;
        String name = entry.displayName();
        if (!entry.resolved()) {
            name = name + " (unmatched)";
        } else if (entry.confidence() < 1.0) {
            name = String.format(Locale.ROOT, "%s [~%.2f %s]", name, entry.confidence(), entry.line().name());
        }
        return String.format(Locale.ROOT, "  [ ] %-8s %-30s %-6s %s", entry.line().reference(), name, quantity, status);
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
