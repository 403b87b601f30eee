package com.partsbin.integration.inventory;

import com.partsbin.core.catalog.InventoryRecord;
import com.partsbin.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Inventory read from an exported JSON file: {@code {"components": [{"category", "subtype", "value",
 * "quantity", "min_quantity"}]}}. Missing fields become {@code null} and are judged by the merger.
 */
public final class JsonInventorySnapshot implements InventorySource {

    private static final Logger LOGGER = AppLogger.get();

    private final Path path;

    public JsonInventorySnapshot(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    public List<InventoryRecord> fetchComponents() throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            JSONObject root = new JSONObject(content);
            JSONArray components = root.optJSONArray("components");
            if (components == null) {
                LOGGER.warning("Inventory snapshot " + path + " has no 'components' array");
                return Collections.emptyList();
            }
            List<InventoryRecord> records = new ArrayList<>(components.length());
            for (int i = 0; i < components.length(); i++) {
                JSONObject component = components.optJSONObject(i);
                if (component == null) {
                    continue;
                }
                records.add(new InventoryRecord(
                    optText(component, "category"),
                    optText(component, "subtype"),
                    optText(component, "value"),
                    optInteger(component, "quantity"),
                    optInteger(component, "min_quantity")));
            }
            LOGGER.info("Read %d inventory record(s) from %s".formatted(records.size(), path));
            return records;
        } catch (JSONException ex) {
            throw new IOException("Failed to parse inventory snapshot " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static String optText(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.get(key).toString();
    }

    private static Integer optInteger(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        Object raw = json.get(key);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException ex) {
            throw new JSONException("'%s' is not a whole number: %s".formatted(key, raw), ex);
        }
    }
}
