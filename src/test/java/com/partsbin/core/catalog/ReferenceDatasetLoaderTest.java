package com.partsbin.core.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceDatasetLoaderTest {

    @TempDir
    Path tempDir;

    private final ReferenceDatasetLoader loader = new ReferenceDatasetLoader();

    @Test
    void readsEveryShapeOfTheBundledFixture() throws IOException {
        List<ReferenceRecord> records;
        try (InputStream input = getClass().getResourceAsStream("/fixtures/reference-components.yaml")) {
            assertNotNull(input, "Fixture missing from test classpath");
            records = loader.load(input, "fixture");
        }

        assertEquals(11, records.size());
        assertTrue(records.contains(new ReferenceRecord("resistors", "", "10K", 40, "essential")));
        assertTrue(records.contains(new ReferenceRecord("capacitors", "ceramic", "100nF", 35, "essential")));
        assertTrue(records.contains(new ReferenceRecord("capacitors", "electrolytic", "47uF", 12, "essential")));
        assertTrue(records.contains(new ReferenceRecord("diodes", "", "1N4148", 30, "essential")),
            "'type' is accepted in place of 'value'");
        assertTrue(records.contains(new ReferenceRecord("transistors", "NPN", "2N5088", 10, null)));
        assertTrue(records.contains(new ReferenceRecord("potentiometers", "trimmers", "10K", null, null)),
            "Bare scalars become value-only entries");
    }

    @Test
    void loadsFromFile() throws IOException {
        Path file = tempDir.resolve("reference.yaml");
        Files.writeString(file, "leds:\n  5mm:\n    - {value: red, usage_count: 3}\n", StandardCharsets.UTF_8);

        List<ReferenceRecord> records = loader.load(file);

        assertEquals(List.of(new ReferenceRecord("leds", "5mm", "red", 3, null)), records);
    }

    @Test
    void emptyDocumentYieldsNoRecords() throws IOException {
        List<ReferenceRecord> records = loader.load(new ByteArrayInputStream(new byte[0]), "empty");
        assertTrue(records.isEmpty());
    }

    @Test
    void nonNumericUsageIsDropped() throws IOException {
        String yaml = "ics:\n  - {value: TL072, usage_count: lots}\n";
        List<ReferenceRecord> records = loader.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
        assertNull(records.get(0).usageCount());
    }

    @Test
    void rejectsTopLevelList() {
        String yaml = "- 10K\n- 4.7K\n";
        IOException ex = assertThrows(IOException.class, () -> loader.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "list.yaml"));
        assertTrue(ex.getMessage().contains("list.yaml"), ex.getMessage());
    }

    @Test
    void wrapsSyntaxErrorsWithTheSourceName() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "resistors: [10K, {value: 4.7K\n", StandardCharsets.UTF_8);

        IOException ex = assertThrows(IOException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("broken.yaml"), ex.getMessage());
    }
}
