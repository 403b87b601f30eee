package com.partsbin.core.location;

import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.SizeClass;
import com.partsbin.core.model.StorageSlot;
import com.partsbin.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Versioned JSON artifact holding the location map.
 * <p>
 * Reads take a shared lock. {@link #extend(UnaryOperator)} takes an exclusive lock (in this JVM and,
 * through a {@code .lock} sidecar, across processes), computes the new map from the current one and
 * replaces the file atomically. A failure at any point leaves the previous artifact in place.
 */
public final class LocationMapStore {

    private static final Logger LOGGER = AppLogger.get();

    private static final Map<Path, ReadWriteLock> LOCKS = new ConcurrentHashMap<>();

    private final Path path;
    private final Clock clock;

    public LocationMapStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public LocationMapStore(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path path() {
        return path;
    }

    /**
     * Current snapshot, or an empty map at version 0 when no artifact exists yet.
     */
    public LocationMap read() throws IOException {
        ReadWriteLock lock = lockFor(path);
        lock.readLock().lock();
        try {
            return readUnlocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies {@code delta} to the current snapshot and persists the result as the next version.
     * The delta may only add entries; a result that drops or moves an existing entry is rejected
     * and nothing is written. A result without new entries writes nothing.
     *
     * @return the snapshot now on disk
     */
    public LocationMap extend(UnaryOperator<LocationMap> delta) throws IOException {
        Objects.requireNonNull(delta, "delta");
        Path directory = path.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        ReadWriteLock lock = lockFor(path);
        lock.writeLock().lock();
        try (FileChannel channel = FileChannel.open(lockFile(),
            StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            LocationMap current = readUnlocked();
            LocationMap next = Objects.requireNonNull(delta.apply(current), "delta result");
            if (!next.preserves(current)) {
                throw new IllegalStateException("Update would move or drop existing locations in " + path);
            }
            if (next.entries().equals(current.entries())) {
                LOGGER.info("Location map %s unchanged at version %d".formatted(path, current.version()));
                return current;
            }
            LocationMap versioned = next.withVersion(current.version() + 1);
            writeAtomically(toJson(versioned, clock.instant()).toString(2));
            LOGGER.info("Wrote location map %s version %d (%d entries)"
                .formatted(path, versioned.version(), versioned.size()));
            return versioned;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private LocationMap readUnlocked() throws IOException {
        if (!Files.exists(path)) {
            return LocationMap.empty();
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return fromJson(new JSONObject(content));
        } catch (JSONException | IllegalArgumentException ex) {
            throw new IOException("Failed to parse location map " + path + ": " + ex.getMessage(), ex);
        }
    }

    private void writeAtomically(String content) throws IOException {
        Path directory = path.getParent();
        Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.fine("Atomic move not supported for " + path + ", replacing instead");
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, "Could not remove temporary file " + temp, ex);
            }
        }
    }

    private Path lockFile() {
        return path.resolveSibling(path.getFileName() + ".lock");
    }

    private static ReadWriteLock lockFor(Path path) {
        return LOCKS.computeIfAbsent(path, ignored -> new ReentrantReadWriteLock());
    }

    static JSONObject toJson(LocationMap map, Instant generatedAt) {
        JSONArray locations = new JSONArray();
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : map.entries().entrySet()) {
            ComponentIdentity identity = entry.getKey();
            JSONArray slots = new JSONArray();
            for (StorageSlot slot : entry.getValue()) {
                JSONObject json = new JSONObject();
                json.put("unit", slot.unit());
                json.put("drawer", slot.drawer());
                json.put("size", slot.sizeClass().name().toLowerCase(Locale.ROOT));
                if (slot.compartment() != null) {
                    json.put("compartment", slot.compartment().intValue());
                }
                slots.put(json);
            }
            JSONObject location = new JSONObject();
            location.put("identity", identity.key());
            location.put("category", identity.category().key());
            location.put("subtype", identity.subtype());
            location.put("value", identity.value());
            location.put("display", slots.length() == 0 ? "" : entry.getValue().get(0).display());
            location.put("slots", slots);
            locations.put(location);
        }
        JSONObject root = new JSONObject();
        root.put("version", map.version());
        root.put("generatedAt", generatedAt.toString());
        root.put("locations", locations);
        return root;
    }

    /**
     * Reads the list form written by this store, and the keyed form
     * {@code "locations": {"<identity key>": [slots]}}.
     */
    static LocationMap fromJson(JSONObject root) {
        int version = root.optInt("version", 0);
        Map<ComponentIdentity, List<StorageSlot>> entries = new LinkedHashMap<>();
        Object locations = root.opt("locations");
        if (locations instanceof JSONArray list) {
            for (int i = 0; i < list.length(); i++) {
                JSONObject location = list.getJSONObject(i);
                ComponentIdentity identity = ComponentIdentity.parseKey(location.getString("identity"));
                putEntry(entries, identity, readSlots(location.getJSONArray("slots")));
            }
        } else if (locations instanceof JSONObject keyed) {
            for (String key : keyed.keySet()) {
                putEntry(entries, ComponentIdentity.parseKey(key), readSlots(keyed.getJSONArray(key)));
            }
        }
        return LocationMap.of(version, entries);
    }

    private static void putEntry(Map<ComponentIdentity, List<StorageSlot>> entries,
                                 ComponentIdentity identity,
                                 List<StorageSlot> slots) {
        if (entries.putIfAbsent(identity, slots) != null) {
            throw new IllegalArgumentException("Duplicate location entry for " + identity.key());
        }
    }

    private static List<StorageSlot> readSlots(JSONArray array) {
        List<StorageSlot> slots = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject json = array.getJSONObject(i);
            String drawer = json.getString("drawer");
            SizeClass sizeClass = json.has("size")
                ? SizeClass.fromName(json.getString("size"))
                : SizeClass.fromDrawerId(drawer)
                    .orElseThrow(() -> new IllegalArgumentException("Cannot infer size of drawer " + drawer));
            Integer compartment = json.has("compartment") && !json.isNull("compartment")
                ? json.getInt("compartment")
                : null;
            slots.add(new StorageSlot(json.getString("unit"), drawer, sizeClass, compartment));
        }
        return slots;
    }
}
