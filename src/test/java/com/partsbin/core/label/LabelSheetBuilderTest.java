package com.partsbin.core.label;

import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelSheetBuilderTest {

    private final LabelSheetBuilder builder = new LabelSheetBuilder();

    @Test
    void drawerFrontPrecedesCompartmentsInPhysicalOrder() {
        LocationMap locations = LocationMap.of(1, Map.of(
            ComponentIdentity.of(Category.RESISTOR, "", "4.7K"), List.of(StorageSlot.parse("U1-S1-3")),
            ComponentIdentity.of(Category.RESISTOR, "", "1K"), List.of(StorageSlot.parse("U1-S1-1")),
            ComponentIdentity.of(Category.RESISTOR, "", "2.2K"), List.of(StorageSlot.parse("U1-S1-2")),
            ComponentIdentity.of(Category.CAPACITOR, "ceramic", "100nF"), List.of(StorageSlot.parse("U1-S17-1")),
            ComponentIdentity.of(Category.POTENTIOMETER, "A", "100K"), List.of(StorageSlot.parse("U2-L1"))));

        List<LabelCell> cells = builder.build(locations);

        assertEquals(List.of(
            new LabelCell("U1", "S1", null, "R: 1K  |  2.2K  |  4.7K"),
            new LabelCell("U1", "S1", 1, "1K"),
            new LabelCell("U1", "S1", 2, "2.2K"),
            new LabelCell("U1", "S1", 3, "4.7K"),
            new LabelCell("U1", "S17", null, "Caps Cer: 100nF"),
            new LabelCell("U1", "S17", 1, "100nF"),
            new LabelCell("U2", "L1", null, "Pots: A100K")), cells);
    }

    @Test
    void mixedDrawerListsEveryPrefix() {
        LocationMap locations = LocationMap.of(1, Map.of(
            ComponentIdentity.of(Category.CAPACITOR, "ceramic", "22pF"), List.of(StorageSlot.parse("U1-S20-1")),
            ComponentIdentity.of(Category.CAPACITOR, "film", "100nF"), List.of(StorageSlot.parse("U1-S20-2"))));

        LabelCell front = builder.build(locations).get(0);

        assertTrue(front.drawerLevel());
        assertEquals("Caps Cer / Caps Film: 22pF  |  100nF", front.text());
    }

    @Test
    void emptyMapHasNoLabels() {
        assertTrue(builder.build(LocationMap.empty()).isEmpty());
    }
}
