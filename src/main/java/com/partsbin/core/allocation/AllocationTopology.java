package com.partsbin.core.allocation;

import com.partsbin.core.model.Category;
import com.partsbin.core.model.SizeClass;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Physical layout reserved per category: the ordered drawers each category may consume.
 * A drawer belongs to at most one category.
 */
public final class AllocationTopology {

    public static final String DEFAULT_RESOURCE = "/default-topology.json";

    private final Map<Category, List<Drawer>> drawersByCategory;

    private AllocationTopology(Map<Category, List<Drawer>> drawersByCategory) {
        this.drawersByCategory = Collections.unmodifiableMap(drawersByCategory);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Candidate drawers for the category in consumption order, empty when none are reserved.
     */
    public List<Drawer> drawers(Category category) {
        return drawersByCategory.getOrDefault(category, List.of());
    }

    public boolean reserves(Category category) {
        return !drawers(category).isEmpty();
    }

    public static AllocationTopology load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return fromJson(content);
        } catch (JSONException | IllegalArgumentException ex) {
            throw new IOException("Failed to parse topology " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static AllocationTopology loadDefault() throws IOException {
        try (InputStream input = AllocationTopology.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            try {
                return fromJson(content);
            } catch (JSONException | IllegalArgumentException ex) {
                throw new IOException("Failed to parse topology " + DEFAULT_RESOURCE + ": " + ex.getMessage(), ex);
            }
        }
    }

    /**
     * Parses {@code {"categories": {"resistor": [{"unit": "U1", "size": "small", "drawers": "S1-S16"}]}}}.
     * {@code drawers} may also be a list of ids.
     */
    public static AllocationTopology fromJson(String content) {
        JSONObject root = new JSONObject(content);
        JSONObject categories = root.optJSONObject("categories");
        if (categories == null) {
            throw new IllegalArgumentException("Topology has no 'categories' object");
        }
        Builder builder = builder();
        for (String name : categories.keySet()) {
            Category category = Category.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown category '" + name + "' in topology"));
            JSONArray ranges = categories.getJSONArray(name);
            for (int i = 0; i < ranges.length(); i++) {
                JSONObject range = ranges.getJSONObject(i);
                String unit = range.getString("unit");
                SizeClass sizeClass = SizeClass.fromName(range.getString("size"));
                Object drawers = range.get("drawers");
                if (drawers instanceof JSONArray list) {
                    List<String> ids = new ArrayList<>(list.length());
                    for (int j = 0; j < list.length(); j++) {
                        ids.add(list.getString(j));
                    }
                    builder.range(category, new DrawerRange(unit, sizeClass, ids));
                } else {
                    builder.range(category, DrawerRange.parse(unit, sizeClass, drawers.toString()));
                }
            }
        }
        return builder.build();
    }

    /**
     * One drawer of the topology.
     */
    public record Drawer(String unit, String drawer, SizeClass sizeClass) {

        public String key() {
            return unit + "-" + drawer;
        }

        public int capacity() {
            return sizeClass.capacity();
        }
    }

    public static final class Builder {
        private final Map<Category, List<Drawer>> drawers = new EnumMap<>(Category.class);
        private final Map<String, Category> owners = new HashMap<>();

        private Builder() {
        }

        public Builder range(Category category, DrawerRange range) {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(range, "range");
            List<Drawer> list = drawers.computeIfAbsent(category, ignored -> new ArrayList<>());
            for (String id : range.drawers()) {
                Drawer drawer = new Drawer(range.unit(), id, range.sizeClass());
                Category owner = owners.putIfAbsent(drawer.key(), category);
                if (owner != null) {
                    throw new IllegalArgumentException("Drawer %s is reserved for both %s and %s"
                        .formatted(drawer.key(), owner.key(), category.key()));
                }
                list.add(drawer);
            }
            return this;
        }

        public Builder range(Category category, String unit, SizeClass sizeClass, String drawers) {
            return range(category, DrawerRange.parse(unit, sizeClass, drawers));
        }

        public AllocationTopology build() {
            Map<Category, List<Drawer>> copy = new EnumMap<>(Category.class);
            drawers.forEach((category, list) -> copy.put(category, List.copyOf(list)));
            return new AllocationTopology(copy);
        }
    }
}
