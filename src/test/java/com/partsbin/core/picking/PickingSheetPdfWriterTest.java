package com.partsbin.core.picking;

import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PickingSheetPdfWriterTest {

    private static final ComponentIdentity R_4K7 = ComponentIdentity.of(Category.RESISTOR, "", "4.7K");
    private static final ComponentIdentity C_100U = ComponentIdentity.of(Category.CAPACITOR, "electrolytic", "100µF");

    @TempDir
    Path tempDir;

    private final PickingSheetPdfWriter writer = new PickingSheetPdfWriter();

    @Test
    void writesLocationsAndSummary() throws IOException {
        LocationMap locations = LocationMap.of(1, Map.of(
            R_4K7, List.of(StorageSlot.parse("U1-S5-1")),
            C_100U, List.of(StorageSlot.parse("U1-S25-2"))));
        PickingSheet sheet = new PickingSheetGenerator().generate("Fuzz Face µ",
            List.of(new BomLine("R1", "4.7K", 1), new BomLine("C1", "capacitor:electrolytic:100uF", 2)),
            locations, Map.of(R_4K7, 5, C_100U, 1));

        Path target = writer.write(sheet, tempDir.resolve("sheets").resolve("fuzz.pdf"));

        assertTrue(Files.size(target) > 0);
        try (PDDocument document = PDDocument.load(target.toFile())) {
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("PICKING SHEET: Fuzz Face u"), "Micro sign is transliterated: " + text);
            assertTrue(text.contains("LOCATION: U1-S5-1 (Front-Left)"), text);
            assertTrue(text.contains("LOCATION: U1-S25-2 (Front-Right)"), text);
            assertTrue(text.contains("100uF electrolytic capacitor"), text);
            assertTrue(text.contains("Unique locations: 2"), text);
        }
    }

    @Test
    void longSheetsSpillOntoMorePages() throws IOException {
        List<BomLine> bom = new ArrayList<>();
        for (int i = 1; i <= 120; i++) {
            bom.add(new BomLine("R" + i, "4.7K", 1));
        }
        LocationMap locations = LocationMap.of(1, Map.of(R_4K7, List.of(StorageSlot.parse("U1-S5-1"))));
        PickingSheet sheet = new PickingSheetGenerator().generate("Big", bom, locations, Map.of(R_4K7, 500));

        Path target = writer.write(sheet, tempDir.resolve("big.pdf"));

        try (PDDocument document = PDDocument.load(target.toFile())) {
            assertTrue(document.getNumberOfPages() > 1);
        }
    }

    @Test
    void printableReplacesGlyphsOutsideWinAnsi() {
        assertEquals("100uF", PickingSheetPdfWriter.printable("100µF"));
        assertEquals("4.7kohm", PickingSheetPdfWriter.printable("4.7kΩ"));
        assertEquals("a?b", PickingSheetPdfWriter.printable("a→b"));
    }
}
