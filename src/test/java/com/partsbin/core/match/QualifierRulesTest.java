package com.partsbin.core.match;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QualifierRulesTest {

    private final QualifierRules rules = QualifierRules.defaults();

    @Test
    void stripsWholeQualifierWordsLongestFirst() {
        assertEquals("TL072", rules.strip(Category.IC, "TL072 Dual Op-Amp"));
        assertEquals("1N34A", rules.strip(Category.DIODE, "1N34A Germanium Diode"));
        assertEquals("2N5088", rules.strip(Category.TRANSISTOR, "NPN  2N5088  transistor"));
        assertEquals("ICL7660", rules.strip(Category.IC, "ICL7660"), "Qualifiers inside a part number stay");
    }

    @Test
    void detectsSubtypeWords() {
        assertEquals("electrolytic", rules.detectSubtype(Category.CAPACITOR, "47uF elect cap"));
        assertEquals("A", rules.detectSubtype(Category.POTENTIOMETER, "100K audio pot"));
        assertEquals("", rules.detectSubtype(Category.RESISTOR, "1/4W metal film"));
    }

    @Test
    void labelPrefixesPerSubtype() {
        assertEquals("Caps Cer", rules.labelPrefix(Category.CAPACITOR, "ceramic"));
        assertEquals("Q NPN", rules.labelPrefix(Category.TRANSISTOR, "NPN"));
        assertEquals("LEDs 5mm", rules.labelPrefix(Category.LED, "5mm"));
        assertEquals("R", rules.labelPrefix(Category.RESISTOR, ""));
    }

    @Test
    void abbreviatesPotentiometersWithTaper() {
        assertEquals("A100K", rules.abbreviate(ComponentIdentity.of(Category.POTENTIOMETER, "A", "100K")));
        assertEquals("10K trim", rules.abbreviate(ComponentIdentity.of(Category.POTENTIOMETER, "trimmer", "10K")));
        assertEquals("4.7K", rules.abbreviate(ComponentIdentity.of(Category.RESISTOR, "", "4.7K")));
    }

    @Test
    void customTableOnlyCoversItsCategories() {
        QualifierRules custom = QualifierRules.builder()
            .category(Category.DIODE, "D", "diode")
            .build();

        assertEquals("1N4148", custom.strip(Category.DIODE, "diode 1N4148"));
        assertEquals("1N4148 silicon", custom.strip(Category.DIODE, "1N4148 silicon"));
        assertEquals("IC", custom.labelPrefix(Category.IC, ""));
    }
}
