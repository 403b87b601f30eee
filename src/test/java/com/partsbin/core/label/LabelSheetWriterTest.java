package com.partsbin.core.label;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelSheetWriterTest {

    @TempDir
    Path tempDir;

    private final LabelSheetWriter writer = new LabelSheetWriter();

    private final List<LabelCell> cells = List.of(
        new LabelCell("U1", "S1", null, "R: 1K  |  2.2K"),
        new LabelCell("U1", "S1", 1, "1K"),
        new LabelCell("U1", "S2", 4, "10K, 1%"));

    @Test
    void writesHeaderAndOneRowPerCell() throws IOException {
        StringBuilder out = new StringBuilder();

        writer.write(cells, out);

        String csv = out.toString();
        assertTrue(csv.startsWith("Unit,Drawer,Compartment,Text\n"), csv);
        assertTrue(csv.contains("U1,S1,,R: 1K  |  2.2K\n"), csv);
        assertTrue(csv.contains("U1,S2,4,\"10K, 1%\"\n"), "Commas are quoted: " + csv);
    }

    @Test
    void writtenFileParsesBack() throws IOException {
        Path target = tempDir.resolve("labels").resolve("labels.csv");

        writer.write(cells, target);

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(target, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(List.of("Unit", "Drawer", "Compartment", "Text"), parser.getHeaderNames());
            assertEquals(3, records.size());
            assertEquals("", records.get(0).get("Compartment"));
            assertEquals("10K, 1%", records.get(2).get("Text"));
        }
    }
}
