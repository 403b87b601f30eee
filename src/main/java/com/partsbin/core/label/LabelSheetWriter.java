package com.partsbin.core.label;

import com.partsbin.logging.AppLogger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Writes label cells as CSV with the columns {@code Unit,Drawer,Compartment,Text}.
 */
public final class LabelSheetWriter {

    private static final Logger LOGGER = AppLogger.get();

    static final String[] HEADER = {"Unit", "Drawer", "Compartment", "Text"};

    public void write(List<LabelCell> cells, Path target) throws IOException {
        Objects.requireNonNull(cells, "cells");
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(cells, writer);
        }
        LOGGER.info("Wrote %d label cell(s) to %s".formatted(cells.size(), target));
    }

    public void write(List<LabelCell> cells, Appendable out) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).setRecordSeparator('\n').build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (LabelCell cell : cells) {
                printer.printRecord(cell.unit(), cell.drawer(),
                    cell.compartment() == null ? "" : cell.compartment().toString(), cell.text());
            }
            printer.flush();
        }
    }
}
