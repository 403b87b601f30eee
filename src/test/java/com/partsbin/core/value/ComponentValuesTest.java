package com.partsbin.core.value;

import com.partsbin.core.model.Category;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentValuesTest {

    @Test
    void parsesResistanceNotations() {
        assertEquals(0, new BigDecimal("4700").compareTo(ComponentValues.parseResistance("4.7k").orElseThrow()));
        assertEquals(0, new BigDecimal("4700").compareTo(ComponentValues.parseResistance("4K7").orElseThrow()));
        assertEquals(0, new BigDecimal("4700").compareTo(ComponentValues.parseResistance("4.7 kΩ").orElseThrow()));
        assertEquals(0, new BigDecimal("2.2").compareTo(ComponentValues.parseResistance("2R2").orElseThrow()));
        assertEquals(0, new BigDecimal("1500000").compareTo(ComponentValues.parseResistance("1M5").orElseThrow()));
        assertTrue(ComponentValues.parseResistance("TL072").isEmpty());
    }

    @Test
    void parsesCapacitanceNotations() {
        BigDecimal hundredNano = new BigDecimal("100000");
        assertEquals(0, hundredNano.compareTo(ComponentValues.parseCapacitance("100nF").orElseThrow()));
        assertEquals(0, hundredNano.compareTo(ComponentValues.parseCapacitance("0.1uF").orElseThrow()));
        assertEquals(0, hundredNano.compareTo(ComponentValues.parseCapacitance("0.1µF").orElseThrow()));
        assertEquals(0, new BigDecimal("4700000").compareTo(ComponentValues.parseCapacitance("4u7").orElseThrow()));
        assertEquals(Optional.empty(), ComponentValues.parseCapacitance("2N5088"), "Part numbers are not values");
    }

    @Test
    void canonicalDisplayPerCategory() {
        assertEquals("4.7K", ComponentValues.canonical(Category.RESISTOR, "4700"));
        assertEquals("100R", ComponentValues.canonical(Category.RESISTOR, "100"));
        assertEquals("1M", ComponentValues.canonical(Category.RESISTOR, "1000k"));
        assertEquals("100nF", ComponentValues.canonical(Category.CAPACITOR, "0.1uF"));
        assertEquals("22pF", ComponentValues.canonical(Category.CAPACITOR, "22p"));
        assertEquals("100K", ComponentValues.canonical(Category.POTENTIOMETER, "100k"));
        assertEquals("1N4148", ComponentValues.canonical(Category.DIODE, "1n4148"));
        assertEquals("Red", ComponentValues.canonical(Category.LED, "RED"));
    }

    @Test
    void decadesBucketByPowerOfTen() {
        assertEquals(0, ComponentValues.decade(new BigDecimal("2.2")));
        assertEquals(2, ComponentValues.decade(new BigDecimal("470")));
        assertEquals(3, ComponentValues.decade(new BigDecimal("4700")));
        assertEquals(6, ComponentValues.decade(new BigDecimal("2200000")));
        assertEquals("1K-10K", ComponentValues.decadeName(3));
        assertEquals("1M+", ComponentValues.decadeName(6));
    }
}
