package com.partsbin.core.picking;

import com.partsbin.core.issue.IssueType;
import com.partsbin.core.issue.StorageIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BomReaderTest {

    @TempDir
    Path tempDir;

    private final BomReader reader = new BomReader();

    @Test
    void readsLinesInFileOrder() throws IOException {
        Path bom = tempDir.resolve("fuzz.csv");
        Files.writeString(bom, """
            Reference,Name,Quantity
            R1,4.7K,1
            D1,1N4148,2

            C1, 100nF ceramic ,
            """, StandardCharsets.UTF_8);

        BomReader.Result result = reader.read(bom);

        assertEquals(List.of(
            new BomLine("R1", "4.7K", 1),
            new BomLine("D1", "1N4148", 2),
            new BomLine("C1", "100nF ceramic", 1)), result.lines());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void referenceAndQuantityColumnsAreOptional() throws IOException {
        BomReader.Result result = reader.read("""
            name
            TL072
            2N5088
            """);

        assertEquals(List.of(new BomLine("", "TL072", 1), new BomLine("", "2N5088", 1)), result.lines());
    }

    @Test
    void badRowsAreReportedAndSkipped() throws IOException {
        BomReader.Result result = reader.read("""
            reference,name,quantity
            R1,10K,abc
            R2,,2
            R3,100K,0
            R4,1M,3
            """);

        assertEquals(List.of(new BomLine("R4", "1M", 3)), result.lines());
        assertEquals(3, result.issues().size());
        assertTrue(result.issues().stream().allMatch(issue -> issue.type() == IssueType.MALFORMED_RECORD));
        StorageIssue first = result.issues().get(0);
        assertEquals("inline BOM row 1", first.subject());
        assertEquals("Quantity is not a number", first.detail());
    }

    @Test
    void missingNameColumnFails() {
        IOException ex = assertThrows(IOException.class, () -> reader.read("""
            reference,quantity
            R1,1
            """));

        assertTrue(ex.getMessage().contains("'name'"), ex.getMessage());
    }
}
