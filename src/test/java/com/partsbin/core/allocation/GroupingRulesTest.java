package com.partsbin.core.allocation;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GroupingRulesTest {

    private final GroupingRules rules = GroupingRules.defaults();

    @Test
    void resistorsPartitionByDecade() {
        List<ComponentGroup> groups = rules.group(Category.RESISTOR, List.of(
            spec(Category.RESISTOR, "", "220K"),
            spec(Category.RESISTOR, "", "4.7K"),
            spec(Category.RESISTOR, "", "1K"),
            spec(Category.RESISTOR, "", "2.2R")));

        assertEquals(List.of("0.1-10", "1K-10K", "100K-1M"), groups.stream().map(ComponentGroup::partition).toList());
        assertEquals(List.of("1K", "4.7K"), values(groups.get(1)), "Members ascend by resistance");
    }

    @Test
    void unparsedResistorValuesGoLast() {
        List<ComponentGroup> groups = rules.group(Category.RESISTOR, List.of(
            spec(Category.RESISTOR, "", "JUMPER"),
            spec(Category.RESISTOR, "", "10K")));

        assertEquals("unparsed", groups.get(groups.size() - 1).partition());
    }

    @Test
    void capacitorsPartitionBySubtypeInKnownOrder() {
        List<ComponentGroup> groups = rules.group(Category.CAPACITOR, List.of(
            spec(Category.CAPACITOR, "tantalum", "10uF"),
            spec(Category.CAPACITOR, "electrolytic", "100uF"),
            spec(Category.CAPACITOR, "film", "1uF"),
            spec(Category.CAPACITOR, "ceramic", "100nF"),
            spec(Category.CAPACITOR, "ceramic", "22pF")));

        assertEquals(List.of("ceramic", "film", "electrolytic", "tantalum"),
            groups.stream().map(ComponentGroup::partition).toList(), "Unknown subtypes sort after known ones");
        assertEquals(List.of("22pF", "100nF"), values(groups.get(0)));
    }

    @Test
    void diodesShareOnePoolInValueOrder() {
        List<ComponentGroup> groups = rules.group(Category.DIODE, List.of(
            spec(Category.DIODE, "", "1N5817"),
            spec(Category.DIODE, "", "1N34A"),
            spec(Category.DIODE, "", "1N4148")));

        assertEquals(1, groups.size());
        assertEquals(List.of("1N34A", "1N4148", "1N5817"), values(groups.get(0)));
    }

    @Test
    void rejectsSpecsOfAnotherCategory() {
        assertThrows(IllegalArgumentException.class,
            () -> rules.group(Category.DIODE, List.of(spec(Category.RESISTOR, "", "1K"))));
    }

    private static List<String> values(ComponentGroup group) {
        return group.members().stream().map(spec -> spec.identity().value()).toList();
    }

    private static ComponentSpec spec(Category category, String subtype, String value) {
        return ComponentSpec.referenceOnly(ComponentIdentity.of(category, subtype, value), 1, Priority.OPTIONAL);
    }
}
