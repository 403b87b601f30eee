package com.partsbin.core.allocation;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.value.ComponentValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Per-category grouping table: how specs are partitioned and in which order they are placed.
 * Every order ends with the identity key, so placement is total and repeatable.
 */
public final class GroupingRules {

    private static final Comparator<ComponentSpec> BY_KEY = Comparator.comparing(spec -> spec.identity().key());

    private static final Comparator<ComponentSpec> BY_MAGNITUDE = Comparator.comparing(
        GroupingRules::magnitude, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()));

    private static final Comparator<ComponentSpec> BY_VALUE = Comparator.comparing(spec -> spec.identity().value());

    private static final GroupingRules DEFAULTS = defaultRules();

    private final Map<Category, Rule> rules;

    private GroupingRules(Map<Category, Rule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static GroupingRules defaults() {
        return DEFAULTS;
    }

    /**
     * Partitions the specs of one category, partitions in their natural order and members sorted.
     */
    public List<ComponentGroup> group(Category category, Collection<ComponentSpec> specs) {
        Objects.requireNonNull(category, "category");
        Rule rule = rules.get(category);
        if (rule == null) {
            throw new IllegalArgumentException("No grouping rule for " + category.key());
        }
        Map<PartitionKey, List<ComponentSpec>> partitions = new TreeMap<>();
        for (ComponentSpec spec : specs) {
            if (spec.category() != category) {
                throw new IllegalArgumentException("%s is not a %s".formatted(spec.identity().key(), category.key()));
            }
            partitions.computeIfAbsent(rule.partition().apply(spec), ignored -> new ArrayList<>()).add(spec);
        }
        List<ComponentGroup> groups = new ArrayList<>(partitions.size());
        for (Map.Entry<PartitionKey, List<ComponentSpec>> entry : partitions.entrySet()) {
            List<ComponentSpec> members = new ArrayList<>(entry.getValue());
            members.sort(rule.order());
            groups.add(new ComponentGroup(category, entry.getKey().label(), members));
        }
        return groups;
    }

    private static GroupingRules defaultRules() {
        Map<Category, Rule> rules = new EnumMap<>(Category.class);
        rules.put(Category.RESISTOR, new Rule(
            GroupingRules::decadePartition,
            BY_MAGNITUDE
                .thenComparing(Comparator.comparingInt((ComponentSpec spec) -> spec.priority().rank()).reversed())
                .thenComparing(Comparator.comparingInt(ComponentSpec::usageCount).reversed())
                .thenComparing(BY_KEY)));
        rules.put(Category.CAPACITOR, new Rule(GroupingRules::subtypePartition, BY_MAGNITUDE.thenComparing(BY_KEY)));
        rules.put(Category.DIODE, new Rule(GroupingRules::singlePool, BY_VALUE.thenComparing(BY_KEY)));
        rules.put(Category.TRANSISTOR, new Rule(GroupingRules::subtypePartition, BY_VALUE.thenComparing(BY_KEY)));
        rules.put(Category.IC, new Rule(GroupingRules::singlePool, BY_VALUE.thenComparing(BY_KEY)));
        rules.put(Category.POTENTIOMETER, new Rule(GroupingRules::singlePool,
            BY_MAGNITUDE.thenComparing(BY_VALUE).thenComparing(BY_KEY)));
        rules.put(Category.LED, new Rule(GroupingRules::subtypePartition, BY_VALUE.thenComparing(BY_KEY)));
        return new GroupingRules(rules);
    }

    private static PartitionKey decadePartition(ComponentSpec spec) {
        Optional<BigDecimal> ohms = ComponentValues.parseResistance(spec.identity().value());
        if (ohms.isEmpty()) {
            return new PartitionKey(Integer.MAX_VALUE, "unparsed");
        }
        int decade = ComponentValues.decade(ohms.get());
        return new PartitionKey(decade, ComponentValues.decadeName(decade));
    }

    private static PartitionKey subtypePartition(ComponentSpec spec) {
        Category category = spec.category();
        String subtype = spec.identity().subtype();
        return new PartitionKey(category.subtypeRank(subtype), subtype);
    }

    private static PartitionKey singlePool(ComponentSpec spec) {
        return new PartitionKey(0, "");
    }

    private static BigDecimal magnitude(ComponentSpec spec) {
        return ComponentValues.magnitude(spec.category(), spec.identity().value()).orElse(null);
    }

    private record Rule(Function<ComponentSpec, PartitionKey> partition, Comparator<ComponentSpec> order) {
    }

    private record PartitionKey(int rank, String label) implements Comparable<PartitionKey> {

        @Override
        public int compareTo(PartitionKey other) {
            int byRank = Integer.compare(rank, other.rank);
            return byRank != 0 ? byRank : label.compareTo(other.label);
        }
    }
}
