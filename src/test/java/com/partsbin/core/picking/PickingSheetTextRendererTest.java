package com.partsbin.core.picking;

import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.Category;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PickingSheetTextRendererTest {

    private static final ComponentIdentity R_4K7 = ComponentIdentity.of(Category.RESISTOR, "", "4.7K");
    private static final ComponentIdentity D_1N4148 = ComponentIdentity.of(Category.DIODE, "", "1N4148");

    @TempDir
    Path tempDir;

    private final PickingSheetTextRenderer renderer = new PickingSheetTextRenderer();

    @Test
    void rendersLocationsEntriesAndSummary() {
        List<String> lines = List.of(renderer.render(sheet()).split("\n"));

        assertEquals("PICKING SHEET: Fuzz Face", lines.get(0));
        assertEquals("=".repeat(70), lines.get(1));
        assertTrue(lines.contains("LOCATION: U1-S5-1 (Front-Left)"), lines.toString());
        assertTrue(lines.contains("LOCATION: U1-S31-4 (Back-Right)"), lines.toString());
        assertTrue(lines.indexOf("LOCATION: U1-S5-1 (Front-Left)") < lines.indexOf("LOCATION: U1-S31-4 (Back-Right)"));
        assertTrue(lines.contains("  [ ] R1" + " ".repeat(7) + "4.7K resistor" + " ".repeat(25) + "in stock"),
            lines.toString());
        assertTrue(lines.contains("  [ ] D1" + " ".repeat(7) + "1N4148 diode" + " ".repeat(19) + "(x2)   needs ordering"),
            lines.toString());
        assertTrue(lines.contains("  Unique locations: 2"));
        assertTrue(lines.contains("  Items in stock: 1/2"));
        assertTrue(lines.contains("  WARNING: 1 item(s) need to be ordered!"));
        assertTrue(lines.contains("    - 1N4148 diode: need 1 more (have 1)"));
    }

    @Test
    void writesUtf8File() throws IOException {
        Path target = tempDir.resolve("out").resolve("sheet.txt");

        renderer.write(sheet(), target);

        assertEquals(renderer.render(sheet()), Files.readString(target, StandardCharsets.UTF_8));
    }

    private static PickingSheet sheet() {
        LocationMap locations = LocationMap.of(1, Map.of(
            R_4K7, List.of(StorageSlot.parse("U1-S5-1")),
            D_1N4148, List.of(StorageSlot.parse("U1-S31-4"))));
        return new PickingSheetGenerator().generate("Fuzz Face",
            List.of(new BomLine("R1", "4.7K", 1), new BomLine("D1", "1N4148", 2)),
            locations, Map.of(R_4K7, 5, D_1N4148, 1));
    }
}
