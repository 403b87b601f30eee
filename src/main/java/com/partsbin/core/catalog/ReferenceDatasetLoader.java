package com.partsbin.core.catalog;

import com.partsbin.logging.AppLogger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the reference dataset YAML.
 * <p>
 * Top-level keys are category names. Each maps either to a list of entries, to a map with a
 * {@code values} list, or to a map of subtype name to such a list:
 * <pre>
 * resistors:
 *   - {value: 10K, usage_count: 40, priority: essential}
 * capacitors:
 *   ceramic:
 *     values:
 *       - {value: 100nF, usage_count: 35, priority: essential}
 * </pre>
 * Entries may name the value under {@code value} or {@code type}.
 */
public final class ReferenceDatasetLoader {

    private static final Logger LOGGER = AppLogger.get();

    public List<ReferenceRecord> load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<ReferenceRecord> records = parse(new Yaml().load(reader), path.toString());
            LOGGER.info("Loaded %d reference entries from %s".formatted(records.size(), path));
            return records;
        } catch (YAMLException ex) {
            throw new IOException("Invalid reference dataset " + path + ": " + ex.getMessage(), ex);
        }
    }

    public List<ReferenceRecord> load(InputStream input, String sourceName) throws IOException {
        Objects.requireNonNull(input, "input");
        try {
            return parse(new Yaml().load(input), sourceName);
        } catch (YAMLException ex) {
            throw new IOException("Invalid reference dataset " + sourceName + ": " + ex.getMessage(), ex);
        }
    }

    private List<ReferenceRecord> parse(Object root, String sourceName) throws IOException {
        if (root == null) {
            return Collections.emptyList();
        }
        if (!(root instanceof Map<?, ?> categories)) {
            throw new IOException("Reference dataset " + sourceName + " must be a mapping of category to entries");
        }
        List<ReferenceRecord> records = new ArrayList<>();
        for (Map.Entry<?, ?> entry : categories.entrySet()) {
            String category = Objects.toString(entry.getKey(), "");
            collect(category, "", entry.getValue(), records);
        }
        return Collections.unmodifiableList(records);
    }

    private void collect(String category, String subtype, Object node, List<ReferenceRecord> out) {
        if (node instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    out.add(toRecord(category, subtype, map));
                } else if (item != null) {
                    out.add(new ReferenceRecord(category, subtype, item.toString(), null, null));
                }
            }
            return;
        }
        if (node instanceof Map<?, ?> map) {
            Object values = map.get("values");
            if (values != null) {
                collect(category, subtype, values, out);
                return;
            }
            for (Map.Entry<?, ?> nested : map.entrySet()) {
                collect(category, Objects.toString(nested.getKey(), ""), nested.getValue(), out);
            }
            return;
        }
        if (node != null) {
            LOGGER.warning("Ignoring reference node for %s: not a list or mapping".formatted(category));
        }
    }

    private static ReferenceRecord toRecord(String category, String subtype, Map<?, ?> map) {
        Object value = map.get("value");
        if (value == null) {
            value = map.get("type");
        }
        Object explicitSubtype = map.get("subtype");
        String effectiveSubtype = explicitSubtype != null ? explicitSubtype.toString() : subtype;
        return new ReferenceRecord(
            category,
            effectiveSubtype,
            value == null ? null : value.toString(),
            toInteger(map.get("usage_count")),
            map.get("priority") == null ? null : map.get("priority").toString());
    }

    private static Integer toInteger(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring non-numeric usage_count '%s'".formatted(raw));
            return null;
        }
    }
}
