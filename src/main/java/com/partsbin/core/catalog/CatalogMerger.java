package com.partsbin.core.catalog;

import com.partsbin.core.issue.AmbiguousIdentityException;
import com.partsbin.core.issue.IssueType;
import com.partsbin.core.issue.MalformedRecordException;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.match.CategoryInference;
import com.partsbin.core.match.FuzzyMatcher;
import com.partsbin.core.match.MatchCandidate;
import com.partsbin.core.match.MatchResult;
import com.partsbin.core.match.QualifierRules;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.model.Priority;
import com.partsbin.core.value.ComponentValues;
import com.partsbin.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Merges inventory rows and reference entries into one {@link ComponentSpec} per identity.
 * <p>
 * Stock figures come from inventory, usage and priority from the reference dataset. Records that
 * cannot be placed under a single identity are withheld and reported, the rest still merge.
 * <p>
 * A record without a category takes the one its value implies; it is ambiguous when its value is
 * also listed under another category. A reference part number with no exact inventory identity is
 * reconciled onto a stocked one of the same category by fuzzy match, but only when both carry the
 * same digits: {@code TL072CP} joins {@code TL072}, {@code 2N5089} never joins {@code 2N5088}.
 */
public final class CatalogMerger {

    private static final Logger LOGGER = AppLogger.get();

    /**
     * Rejected reconciliations scoring at least this much are reported as near misses.
     */
    static final double NEAR_MISS = 0.7;

    private static final Set<Category> PART_NUMBERED = EnumSet.of(Category.DIODE, Category.TRANSISTOR, Category.IC);

    private final QualifierRules rules;
    private final FuzzyMatcher matcher;

    public CatalogMerger() {
        this(QualifierRules.defaults(), new FuzzyMatcher());
    }

    public CatalogMerger(FuzzyMatcher matcher) {
        this(QualifierRules.defaults(), matcher);
    }

    public CatalogMerger(QualifierRules rules, FuzzyMatcher matcher) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public CatalogMergeResult merge(Collection<InventoryRecord> inventory, Collection<ReferenceRecord> reference) {
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(reference, "reference");
        List<StorageIssue> issues = new ArrayList<>();
        Map<Category, Set<String>> declared = declaredValues(inventory, reference);

        List<Resolved<InventoryRecord>> stocked = new ArrayList<>();
        for (InventoryRecord record : inventory) {
            try {
                Category category = categoryOf(record.category(), record.value(), record.describe(), declared);
                stocked.add(new Resolved<>(record, record.describe(), resolveInventory(category, record)));
            } catch (MalformedRecordException ex) {
                issues.add(ex.toIssue());
            } catch (AmbiguousIdentityException ex) {
                issues.add(ex.toIssue());
            }
        }

        Map<String, Set<String>> stockedSubtypes = new TreeMap<>();
        for (Resolved<InventoryRecord> resolved : stocked) {
            ComponentIdentity identity = resolved.identity();
            stockedSubtypes.computeIfAbsent(valueKey(identity.category(), identity.value()), ignored -> new TreeSet<>())
                .add(identity.subtype());
        }
        Set<ComponentIdentity> stockedIdentities = new TreeSet<>();
        stocked.forEach(resolved -> stockedIdentities.add(resolved.identity()));

        List<Resolved<ReferenceRecord>> referenced = new ArrayList<>();
        for (ReferenceRecord record : reference) {
            try {
                Category category = categoryOf(record.category(), record.value(), record.describe(), declared);
                ComponentIdentity identity = resolveReference(category, record, stockedSubtypes);
                referenced.add(new Resolved<>(record, record.describe(), reconcile(record, identity, stockedIdentities, issues)));
            } catch (MalformedRecordException ex) {
                issues.add(ex.toIssue());
            } catch (AmbiguousIdentityException ex) {
                issues.add(ex.toIssue());
            }
        }

        Map<String, Accumulator> merged = new TreeMap<>();
        for (Resolved<InventoryRecord> resolved : stocked) {
            InventoryRecord record = resolved.record();
            merged.computeIfAbsent(resolved.identity().key(), ignored -> new Accumulator(resolved.identity()))
                .addStock(valueOrZero(record.quantity()), valueOrZero(record.minQuantity()));
        }
        for (Resolved<ReferenceRecord> resolved : referenced) {
            ReferenceRecord record = resolved.record();
            merged.computeIfAbsent(resolved.identity().key(), ignored -> new Accumulator(resolved.identity()))
                .addReference(valueOrZero(record.usageCount()), Priority.fromName(record.priority()));
        }

        List<ComponentSpec> specs = new ArrayList<>(merged.size());
        int belowMinimum = 0;
        for (Accumulator accumulator : merged.values()) {
            ComponentSpec spec = accumulator.toSpec();
            if (spec.belowMinimum()) {
                belowMinimum++;
                LOGGER.fine(() -> "%s is below its minimum (%d of %d)"
                    .formatted(spec.identity().key(), spec.quantityOnHand(), spec.minQuantity()));
            }
            specs.add(spec);
        }
        LOGGER.info("Merged %d inventory and %d reference records into %d component types (%d below minimum, %d issue(s))"
            .formatted(inventory.size(), reference.size(), specs.size(), belowMinimum, issues.size()));
        return new CatalogMergeResult(specs, issues);
    }

    private ComponentIdentity resolveInventory(Category category, InventoryRecord record) throws MalformedRecordException {
        if (record.quantity() != null && record.quantity() < 0) {
            throw new MalformedRecordException(record.describe(), "Negative quantity " + record.quantity());
        }
        if (record.minQuantity() != null && record.minQuantity() < 0) {
            throw new MalformedRecordException(record.describe(), "Negative minimum quantity " + record.minQuantity());
        }
        ComponentIdentity identity = identity(category, record.subtype(), record.value(), record.describe());
        if (identity.subtype().isEmpty() && category.hasSubtypes()) {
            return new ComponentIdentity(category, category.defaultSubtype(), identity.value());
        }
        return identity;
    }

    private ComponentIdentity resolveReference(Category category, ReferenceRecord record, Map<String, Set<String>> stockedSubtypes)
        throws MalformedRecordException, AmbiguousIdentityException {
        if (record.usageCount() != null && record.usageCount() < 0) {
            throw new MalformedRecordException(record.describe(), "Negative usage count " + record.usageCount());
        }
        ComponentIdentity identity = identity(category, record.subtype(), record.value(), record.describe());
        if (!identity.subtype().isEmpty() || !category.hasSubtypes()) {
            return identity;
        }
        Set<String> subtypes = stockedSubtypes.getOrDefault(valueKey(category, identity.value()), Set.of());
        if (subtypes.size() > 1) {
            throw new AmbiguousIdentityException(record.describe(),
                "No subtype given and inventory holds %s as %s".formatted(identity.value(), String.join(", ", subtypes)));
        }
        String subtype = subtypes.isEmpty() ? category.defaultSubtype() : subtypes.iterator().next();
        return new ComponentIdentity(category, subtype, identity.value());
    }

    private ComponentIdentity identity(Category category, String subtype, String value, String subject)
        throws MalformedRecordException {
        if (value == null || value.isBlank()) {
            throw new MalformedRecordException(subject, "Missing value");
        }
        String rawSubtype = subtype;
        if ((rawSubtype == null || rawSubtype.isBlank()) && category.hasSubtypes()) {
            rawSubtype = rules.detectSubtype(category, value);
        }
        String stripped = rules.strip(category, value);
        String rawValue = stripped.isEmpty() ? value : stripped;
        try {
            return ComponentIdentity.of(category, rawSubtype, rawValue);
        } catch (IllegalArgumentException ex) {
            throw new MalformedRecordException(subject, ex.getMessage());
        }
    }

    /**
     * Fuzzy-matches a reference part number onto a stocked identity of its category when no stocked
     * identity equals it. Values of the other categories are canonical or descriptive and stay as they are.
     */
    private ComponentIdentity reconcile(ReferenceRecord record,
                                        ComponentIdentity identity,
                                        Set<ComponentIdentity> stockedIdentities,
                                        List<StorageIssue> issues) {
        if (stockedIdentities.contains(identity) || !PART_NUMBERED.contains(identity.category())) {
            return identity;
        }
        List<MatchCandidate> candidates = new ArrayList<>();
        for (ComponentIdentity stocked : stockedIdentities) {
            if (stocked.category() == identity.category()
                && (identity.subtype().isEmpty() || identity.subtype().equalsIgnoreCase(stocked.subtype()))) {
                candidates.add(MatchCandidate.of(stocked));
            }
        }
        if (candidates.isEmpty()) {
            return identity;
        }
        MatchResult match = matcher.match(identity.value(), identity.category(), candidates);
        Optional<ComponentIdentity> best = match.isMatched() ? match.identity() : match.bestRejected();
        if (best.isEmpty()) {
            return identity;
        }
        ComponentIdentity target = best.get();
        if (match.isMatched() && digits(target.value()).equals(digits(identity.value()))) {
            LOGGER.info("Reconciled %s onto stocked %s (score %.2f)".formatted(record.describe(), target.key(), match.score()));
            return target;
        }
        if (match.score() >= NEAR_MISS) {
            issues.add(StorageIssue.of(IssueType.UNMATCHED_COMPONENT, record.describe(),
                "Kept apart from stocked %s (score %.2f); add it to inventory or fix the name"
                    .formatted(target.key(), match.score())));
        }
        return identity;
    }

    /**
     * Declared category, or for records without one the single category their value points to.
     */
    private Category categoryOf(String raw, String value, String subject, Map<Category, Set<String>> declared)
        throws MalformedRecordException, AmbiguousIdentityException {
        if (raw != null && !raw.isBlank()) {
            return Category.fromName(raw)
                .orElseThrow(() -> new MalformedRecordException(subject, "Unknown category '" + raw + "'"));
        }
        if (value == null || value.isBlank()) {
            throw new MalformedRecordException(subject, "Missing category");
        }
        Set<Category> possible = EnumSet.noneOf(Category.class);
        CategoryInference.infer(value).ifPresent(possible::add);
        for (Map.Entry<Category, Set<String>> entry : declared.entrySet()) {
            if (entry.getValue().contains(canonicalValue(entry.getKey(), value))) {
                possible.add(entry.getKey());
            }
        }
        if (possible.isEmpty()) {
            throw new MalformedRecordException(subject, "Missing category");
        }
        if (possible.size() > 1) {
            List<String> names = possible.stream().map(Category::key).toList();
            throw new AmbiguousIdentityException(subject,
                "No category given and %s is listed as %s".formatted(value.trim(), String.join(", ", names)));
        }
        return possible.iterator().next();
    }

    private Map<Category, Set<String>> declaredValues(Collection<InventoryRecord> inventory,
                                                      Collection<ReferenceRecord> reference) {
        Map<Category, Set<String>> declared = new EnumMap<>(Category.class);
        for (InventoryRecord record : inventory) {
            addDeclared(declared, record.category(), record.value());
        }
        for (ReferenceRecord record : reference) {
            addDeclared(declared, record.category(), record.value());
        }
        return declared;
    }

    private void addDeclared(Map<Category, Set<String>> declared, String rawCategory, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        Category.fromName(rawCategory).ifPresent(category ->
            declared.computeIfAbsent(category, ignored -> new TreeSet<>()).add(canonicalValue(category, value)));
    }

    private String canonicalValue(Category category, String value) {
        String stripped = rules.strip(category, value);
        return ComponentValues.canonical(category, stripped.isEmpty() ? value : stripped).toUpperCase(Locale.ROOT);
    }

    private static String digits(String value) {
        return value.replaceAll("\\D", "");
    }

    private static String valueKey(Category category, String value) {
        return category.key() + "|" + value;
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private record Resolved<R>(R record, String subject, ComponentIdentity identity) {
    }

    private static final class Accumulator {
        private final ComponentIdentity identity;
        private int quantity;
        private int minQuantity;
        private int usageCount;
        private Priority priority = Priority.OPTIONAL;

        private Accumulator(ComponentIdentity identity) {
            this.identity = identity;
        }

        void addStock(int quantity, int minQuantity) {
            this.quantity += quantity;
            this.minQuantity = Math.max(this.minQuantity, minQuantity);
        }

        void addReference(int usageCount, Priority priority) {
            this.usageCount = Math.max(this.usageCount, usageCount);
            if (priority.rank() > this.priority.rank()) {
                this.priority = priority;
            }
        }

        ComponentSpec toSpec() {
            return new ComponentSpec(identity, usageCount, priority, quantity, minQuantity);
        }
    }
}
