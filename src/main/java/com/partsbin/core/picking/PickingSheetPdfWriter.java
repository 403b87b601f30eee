package com.partsbin.core.picking;

import com.partsbin.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Writes a picking sheet as a PDF: one section per location, one checkbox line per entry.
 */
public class PickingSheetPdfWriter {

    private static final Logger LOGGER = AppLogger.get();

    private static final float MARGIN = 40f;
    private static final float LINE_HEIGHT = 14f;
    private static final float FONT_SIZE = 10f;
    private static final float HEADER_SIZE = 14f;
    private static final float BOX_SIZE = 8f;

    /**
     * @throws IOException if the document cannot be written
     */
    public Path write(PickingSheet sheet, Path target) throws IOException {
        Objects.requireNonNull(sheet, "sheet");
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (PDDocument document = new PDDocument()) {
            PageCursor cursor = new PageCursor(document);
            try {
                cursor.text("PICKING SHEET: " + sheet.title(), PDType1Font.HELVETICA_BOLD, HEADER_SIZE, MARGIN);
                cursor.text("Total BOM items: " + sheet.summary().totalLineItems(), PDType1Font.HELVETICA, FONT_SIZE, MARGIN);
                for (PickGroup group : sheet.groups()) {
                    cursor.gap();
                    cursor.text("LOCATION: " + group.label(), PDType1Font.HELVETICA_BOLD, 12f, MARGIN);
                    for (PickListEntry entry : group.entries()) {
                        cursor.checkbox(MARGIN + 6);
                        cursor.text(entryText(entry), PDType1Font.HELVETICA, FONT_SIZE, MARGIN + 6 + BOX_SIZE + 6);
                    }
                }
                writeSummary(cursor, sheet.summary());
            } finally {
                cursor.close();
            }
            document.save(target.toFile());
        }
        LOGGER.info("Wrote picking sheet PDF " + target);
        return target;
    }

    private void writeSummary(PageCursor cursor, PickingSummary summary) throws IOException {
        cursor.gap();
        cursor.text("SUMMARY", PDType1Font.HELVETICA_BOLD, 12f, MARGIN);
        cursor.text("Total items to pick: " + summary.totalLineItems(), PDType1Font.HELVETICA, FONT_SIZE, MARGIN);
        cursor.text("Unique locations: " + summary.uniqueLocations(), PDType1Font.HELVETICA, FONT_SIZE, MARGIN);
        cursor.text("Items in stock: %d/%d".formatted(summary.itemsInStock(), summary.totalLineItems()),
            PDType1Font.HELVETICA, FONT_SIZE, MARGIN);
        if (!summary.shortages().isEmpty()) {
            cursor.text("Missing items:", PDType1Font.HELVETICA_BOLD, FONT_SIZE, MARGIN);
            for (ShortageItem item : summary.shortages()) {
                cursor.text("- %s: need %d more (have %d)".formatted(item.name(), item.shortfall(), item.onHand()),
                    PDType1Font.HELVETICA, FONT_SIZE, MARGIN + 10);
            }
        }
        if (!summary.unmatched().isEmpty()) {
            cursor.text("Unmatched names:", PDType1Font.HELVETICA_BOLD, FONT_SIZE, MARGIN);
            for (String name : summary.unmatched()) {
                cursor.text("- " + name, PDType1Font.HELVETICA, FONT_SIZE, MARGIN + 10);
            }
        }
    }

    private static String entryText(PickListEntry entry) {
        StringBuilder text = new StringBuilder();
        if (!entry.line().reference().isEmpty()) {
            text.append(entry.line().reference()).append("  ");
        }
        text.append(entry.displayName());
        if (!entry.resolved()) {
            text.append(" (unmatched)");
        }
        if (entry.required() > 1) {
            text.append("  (x").append(entry.required()).append(')');
        }
        text.append("  - ").append(entry.sufficient()
            ? PickingSheetTextRenderer.IN_STOCK
            : PickingSheetTextRenderer.NEEDS_ORDERING + ", short " + entry.shortfall());
        return text.toString();
    }

    /**
     * Standard 14 fonts only cover WinAnsi; anything else is replaced so showText never fails.
     */
    static String printable(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == 'µ' || c == 'μ') {
                builder.append('u');
            } else if (c == 'Ω' || c == 'Ω') {
                builder.append("ohm");
            } else if (c >= 0x20 && c < 0x7f) {
                builder.append(c);
            } else {
                builder.append('?');
            }
        }
        return builder.toString();
    }

    private static final class PageCursor {
        private final PDDocument document;
        private PDPageContentStream stream;
        private float y;

        private PageCursor(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void text(String text, PDFont font, float size, float x) throws IOException {
            ensureRoom();
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(x, y);
            stream.showText(printable(text));
            stream.endText();
            y -= LINE_HEIGHT;
        }

        /**
         * Draws an empty checkbox on the current line; the following {@link #text} call shares the line.
         */
        void checkbox(float x) throws IOException {
            ensureRoom();
            stream.addRect(x, y - 1, BOX_SIZE, BOX_SIZE);
            stream.stroke();
        }

        void gap() {
            y -= LINE_HEIGHT / 2;
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private void ensureRoom() throws IOException {
            if (y < MARGIN) {
                newPage();
            }
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }
    }
}
