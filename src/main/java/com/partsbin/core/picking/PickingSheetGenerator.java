package com.partsbin.core.picking;

import com.partsbin.core.issue.IssueType;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.location.LocationMap;
import com.partsbin.core.match.FuzzyMatcher;
import com.partsbin.core.match.MatchCandidate;
import com.partsbin.core.match.MatchResult;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.model.StorageSlot;
import com.partsbin.core.value.ComponentValues;
import com.partsbin.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Resolves a BOM against the location map and stock and lays it out in physical walking order.
 * Nothing is dropped: unmatched names and identities without a slot end up in a trailing group.
 */
public final class PickingSheetGenerator {

    private static final Logger LOGGER = AppLogger.get();

    private final FuzzyMatcher matcher;

    public PickingSheetGenerator() {
        this(new FuzzyMatcher());
    }

    public PickingSheetGenerator(FuzzyMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public PickingSheet generate(String title,
                                 List<BomLine> bom,
                                 LocationMap locations,
                                 Map<ComponentIdentity, Integer> stock) {
        return generate(title, bom, locations, stock, List.of());
    }

    /**
     * @param catalog optional merged specs; they widen the candidate set and supply usage counts for tie breaks
     */
    public PickingSheet generate(String title,
                                 List<BomLine> bom,
                                 LocationMap locations,
                                 Map<ComponentIdentity, Integer> stock,
                                 Collection<ComponentSpec> catalog) {
        Objects.requireNonNull(bom, "bom");
        Objects.requireNonNull(locations, "locations");
        Objects.requireNonNull(stock, "stock");
        Objects.requireNonNull(catalog, "catalog");

        Map<ComponentIdentity, MatchCandidate> candidates = candidates(locations, stock, catalog);
        List<StorageIssue> issues = new ArrayList<>();
        Map<StorageSlot, List<PickListEntry>> bySlot = new TreeMap<>(StorageSlot.PHYSICAL_ORDER);
        List<PickListEntry> unlocatedEntries = new ArrayList<>();
        List<String> unmatched = new ArrayList<>();
        List<String> unlocated = new ArrayList<>();

        for (BomLine line : bom) {
            Resolution resolution = resolve(line.name(), candidates);
            if (resolution.identity() == null) {
                unmatched.add(line.name());
                issues.add(StorageIssue.of(IssueType.UNMATCHED_COMPONENT, line.name(), resolution.detail()));
                unlocatedEntries.add(new PickListEntry(line, null, null, 0, resolution.confidence()));
                continue;
            }
            ComponentIdentity identity = resolution.identity();
            int onHand = stock.getOrDefault(identity, 0);
            StorageSlot slot = locations.primarySlot(identity).orElse(null);
            PickListEntry entry = new PickListEntry(line, identity, slot, onHand, resolution.confidence());
            if (slot == null) {
                unlocated.add(line.name());
                issues.add(StorageIssue.of(IssueType.UNRESOLVED_LOCATION, identity.key(),
                    "%s has no storage location".formatted(line.name())));
                unlocatedEntries.add(entry);
            } else {
                bySlot.computeIfAbsent(slot, ignored -> new ArrayList<>()).add(entry);
            }
        }

        List<PickGroup> groups = new ArrayList<>();
        bySlot.forEach((slot, entries) -> groups.add(new PickGroup(slot, entries)));
        if (!unlocatedEntries.isEmpty()) {
            groups.add(new PickGroup(null, unlocatedEntries));
        }

        List<PickListEntry> ordered = new ArrayList<>(bom.size());
        List<ShortageItem> shortages = new ArrayList<>();
        int inStock = 0;
        for (PickGroup group : groups) {
            for (PickListEntry entry : group.entries()) {
                ordered.add(entry);
                if (entry.sufficient()) {
                    inStock++;
                } else {
                    shortages.add(ShortageItem.of(entry));
                }
            }
        }

        PickingSummary summary = new PickingSummary(bom.size(), bySlot.size(), inStock, shortages, unmatched, unlocated);
        LOGGER.info("Picking sheet '%s': %d line(s), %d location(s), %d short, %d unmatched"
            .formatted(title, bom.size(), bySlot.size(), shortages.size(), unmatched.size()));
        return new PickingSheet(title, ordered, groups, summary, issues);
    }

    private Resolution resolve(String name, Map<ComponentIdentity, MatchCandidate> candidates) {
        String trimmed = name.trim();
        if (trimmed.indexOf(':') > 0) {
            try {
                ComponentIdentity byKey = ComponentIdentity.parseKey(trimmed);
                if (candidates.containsKey(byKey)) {
                    return new Resolution(byKey, 1.0, "");
                }
            } catch (IllegalArgumentException ex) {
                LOGGER.fine("'%s' is not an identity key: %s".formatted(trimmed, ex.getMessage()));
            }
        }

        Set<ComponentIdentity> exact = new TreeSet<>();
        for (ComponentIdentity identity : candidates.keySet()) {
            if (sameValue(identity, trimmed)) {
                exact.add(identity);
            }
        }
        if (exact.size() == 1) {
            return new Resolution(exact.iterator().next(), 1.0, "");
        }

        MatchResult match = matcher.match(trimmed, candidates.values());
        if (match.isMatched()) {
            return new Resolution(match.identity().orElseThrow(), match.score(), "");
        }
        return new Resolution(null, match.score(), match.describe());
    }

    private static boolean sameValue(ComponentIdentity identity, String name) {
        if (identity.value().equalsIgnoreCase(name)) {
            return true;
        }
        Category category = identity.category();
        return ComponentValues.canonical(category, name).equalsIgnoreCase(identity.value());
    }

    private static Map<ComponentIdentity, MatchCandidate> candidates(LocationMap locations,
                                                                     Map<ComponentIdentity, Integer> stock,
                                                                     Collection<ComponentSpec> catalog) {
        Map<ComponentIdentity, MatchCandidate> candidates = new LinkedHashMap<>();
        for (ComponentSpec spec : catalog) {
            candidates.put(spec.identity(), MatchCandidate.of(spec));
        }
        for (ComponentIdentity identity : locations.entries().keySet()) {
            candidates.putIfAbsent(identity, MatchCandidate.of(identity));
        }
        for (ComponentIdentity identity : stock.keySet()) {
            candidates.putIfAbsent(identity, MatchCandidate.of(identity));
        }
        return candidates;
    }

    private record Resolution(ComponentIdentity identity, double confidence, String detail) {
    }
}
