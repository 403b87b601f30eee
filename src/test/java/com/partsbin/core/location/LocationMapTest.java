package com.partsbin.core.location;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationMapTest {

    private static final ComponentIdentity R_1K = ComponentIdentity.of(Category.RESISTOR, "", "1K");
    private static final ComponentIdentity R_10K = ComponentIdentity.of(Category.RESISTOR, "", "10K");

    @Test
    void slotHoldsOneIdentityOnly() {
        StorageSlot slot = StorageSlot.parse("U1-S1-1");
        assertThrows(IllegalArgumentException.class,
            () -> LocationMap.of(1, Map.of(R_1K, List.of(slot), R_10K, List.of(slot))));
        assertThrows(IllegalArgumentException.class, () -> LocationMap.of(1, Map.of(R_1K, List.of())));
    }

    @Test
    void extendingKeepsPriorEntries() {
        LocationMap prior = LocationMap.of(3, Map.of(R_1K, List.of(StorageSlot.parse("U1-S1-1"))));

        LocationMap extended = prior.extendedWith(Map.of(R_10K, List.of(StorageSlot.parse("U1-S2-1"))));

        assertTrue(extended.preserves(prior));
        assertFalse(prior.preserves(extended));
        assertEquals(3, extended.version(), "Versions are assigned by the store");
        assertEquals(Set.of("U1-S1", "U1-S2"), extended.occupiedDrawerKeys());
        assertEquals(R_10K, extended.occupant(StorageSlot.parse("U1-S2-1")).orElseThrow());
        assertThrows(IllegalArgumentException.class,
            () -> extended.extendedWith(Map.of(R_1K, List.of(StorageSlot.parse("U1-S3-1")))));
    }

    @Test
    void firstSlotIsPrimary() {
        LocationMap map = LocationMap.of(1, Map.of(R_1K,
            List.of(StorageSlot.parse("U1-S4-2"), StorageSlot.parse("U1-S9-1"))));

        assertEquals("U1-S4-2", map.primarySlot(R_1K).orElseThrow().display());
        assertEquals(2, map.slots(R_1K).size());
        assertTrue(map.primarySlot(R_10K).isEmpty());
    }
}
