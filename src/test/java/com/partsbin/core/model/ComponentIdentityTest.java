package com.partsbin.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComponentIdentityTest {

    @Test
    void canonicalizesSubtypeAndValueSpelling() {
        ComponentIdentity cap = ComponentIdentity.of(Category.CAPACITOR, "MLCC", "0.1uF");
        assertEquals("capacitor:ceramic:100nF", cap.key());

        ComponentIdentity resistor = ComponentIdentity.of(Category.RESISTOR, null, "4k7");
        assertEquals("resistor::4.7K", resistor.key());
        assertEquals("4.7K resistor", resistor.displayName());
    }

    @Test
    void extractsTaperFromPotentiometerValue() {
        ComponentIdentity pot = ComponentIdentity.of(Category.POTENTIOMETER, "", "A100K");
        assertEquals("A", pot.subtype());
        assertEquals("100K", pot.value());
    }

    @Test
    void keyRoundTripsThroughParse() {
        ComponentIdentity identity = ComponentIdentity.of(Category.TRANSISTOR, "npn", "2n5088");
        assertEquals(identity, ComponentIdentity.parseKey(identity.key()));
        assertEquals("transistor:NPN:2N5088", identity.key());
    }

    @Test
    void rejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> ComponentIdentity.parseKey("resistor-4.7K"));
        assertThrows(IllegalArgumentException.class, () -> ComponentIdentity.parseKey("inductor::10uH"));
        assertThrows(IllegalArgumentException.class, () -> ComponentIdentity.of(Category.DIODE, "", " "));
    }
}
