package com.partsbin.core.picking;

import com.partsbin.core.issue.IssueType;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.logging.AppLogger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads a BOM CSV with the header {@code reference,name,quantity}. The reference column is optional;
 * a missing quantity means 1. Rows that cannot be read are reported, the rest are kept in file order.
 */
public final class BomReader {

    private static final Logger LOGGER = AppLogger.get();

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    public Result read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Result result = read(reader, path.getFileName().toString());
            LOGGER.info("Read %d BOM line(s) from %s".formatted(result.lines().size(), path));
            return result;
        }
    }

    public Result read(String content) throws IOException {
        return read(new StringReader(content), "inline BOM");
    }

    private Result read(Reader reader, String source) throws IOException {
        List<BomLine> lines = new ArrayList<>();
        List<StorageIssue> issues = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            if (!hasColumn(parser, "name")) {
                throw new IOException("BOM " + source + " has no 'name' column");
            }
            boolean hasReference = hasColumn(parser, "reference");
            boolean hasQuantity = hasColumn(parser, "quantity");
            for (CSVRecord record : parser) {
                String subject = "%s row %d".formatted(source, record.getRecordNumber());
                try {
                    String reference = hasReference && record.isSet("reference") ? record.get("reference") : "";
                    String name = record.isSet("name") ? record.get("name") : "";
                    String rawQuantity = hasQuantity && record.isSet("quantity") ? record.get("quantity") : "";
                    int quantity = rawQuantity.isEmpty() ? 1 : Integer.parseInt(rawQuantity);
                    lines.add(new BomLine(reference, name, quantity));
                } catch (NumberFormatException ex) {
                    issues.add(StorageIssue.of(IssueType.MALFORMED_RECORD, subject, "Quantity is not a number"));
                } catch (IllegalArgumentException ex) {
                    issues.add(StorageIssue.of(IssueType.MALFORMED_RECORD, subject, ex.getMessage()));
                }
            }
        } catch (IllegalStateException | UncheckedIOException ex) {
            throw new IOException("Failed to read BOM " + source + ": " + ex.getMessage(), ex);
        }
        return new Result(lines, issues);
    }

    private static boolean hasColumn(CSVParser parser, String column) {
        return parser.getHeaderNames().stream().anyMatch(column::equalsIgnoreCase);
    }

    /**
     * Lines read in file order and the rows that were skipped.
     */
    public record Result(List<BomLine> lines, List<StorageIssue> issues) {

        public Result {
            lines = List.copyOf(lines);
            issues = List.copyOf(issues);
        }
    }
}
