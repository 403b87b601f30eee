package com.partsbin.core.location;

import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of where each identity lives. The first slot of an entry is its primary slot.
 * A slot holds at most one identity.
 */
public final class LocationMap {

    private static final LocationMap EMPTY = new LocationMap(0, new TreeMap<>());

    private final int version;
    private final SortedMap<ComponentIdentity, List<StorageSlot>> entries;
    private final Map<StorageSlot, ComponentIdentity> occupants;

    private LocationMap(int version, SortedMap<ComponentIdentity, List<StorageSlot>> entries) {
        if (version < 0) {
            throw new IllegalArgumentException("Negative location map version " + version);
        }
        Map<StorageSlot, ComponentIdentity> occupants = new HashMap<>();
        SortedMap<ComponentIdentity, List<StorageSlot>> copy = new TreeMap<>();
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : entries.entrySet()) {
            ComponentIdentity identity = Objects.requireNonNull(entry.getKey(), "identity");
            List<StorageSlot> slots = List.copyOf(entry.getValue());
            if (slots.isEmpty()) {
                throw new IllegalArgumentException("No slots for " + identity.key());
            }
            for (StorageSlot slot : slots) {
                ComponentIdentity previous = occupants.putIfAbsent(slot, identity);
                if (previous != null) {
                    throw new IllegalArgumentException("Slot %s assigned to both %s and %s"
                        .formatted(slot.display(), previous.key(), identity.key()));
                }
            }
            copy.put(identity, slots);
        }
        this.version = version;
        this.entries = Collections.unmodifiableSortedMap(copy);
        this.occupants = Collections.unmodifiableMap(occupants);
    }

    public static LocationMap empty() {
        return EMPTY;
    }

    public static LocationMap of(int version, Map<ComponentIdentity, List<StorageSlot>> entries) {
        Objects.requireNonNull(entries, "entries");
        return new LocationMap(version, new TreeMap<>(entries));
    }

    public int version() {
        return version;
    }

    /**
     * Entries in identity-key order.
     */
    public SortedMap<ComponentIdentity, List<StorageSlot>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean contains(ComponentIdentity identity) {
        return entries.containsKey(identity);
    }

    public List<StorageSlot> slots(ComponentIdentity identity) {
        return entries.getOrDefault(identity, List.of());
    }

    public Optional<StorageSlot> primarySlot(ComponentIdentity identity) {
        List<StorageSlot> slots = entries.get(identity);
        return slots == null ? Optional.empty() : Optional.of(slots.get(0));
    }

    public Optional<ComponentIdentity> occupant(StorageSlot slot) {
        return Optional.ofNullable(occupants.get(slot));
    }

    /**
     * Drawers ({@code unit-drawer}) holding at least one entry.
     */
    public Set<String> occupiedDrawerKeys() {
        Set<String> keys = new TreeSet<>();
        for (StorageSlot slot : occupants.keySet()) {
            keys.add(slot.drawerKey());
        }
        return keys;
    }

    /**
     * A map holding every entry of this one plus the additions. Additions may not touch existing
     * identities or occupied slots.
     */
    public LocationMap extendedWith(Map<ComponentIdentity, List<StorageSlot>> additions) {
        Objects.requireNonNull(additions, "additions");
        SortedMap<ComponentIdentity, List<StorageSlot>> merged = new TreeMap<>(entries);
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : additions.entrySet()) {
            if (merged.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Identity already located: " + entry.getKey().key());
            }
            merged.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return new LocationMap(version, merged);
    }

    public LocationMap withVersion(int newVersion) {
        return new LocationMap(newVersion, entries);
    }

    /**
     * True when every entry of {@code prior} appears here with the same slot list.
     */
    public boolean preserves(LocationMap prior) {
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : prior.entries().entrySet()) {
            if (!entry.getValue().equals(entries.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LocationMap that)) {
            return false;
        }
        return version == that.version && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, entries);
    }

    @Override
    public String toString() {
        return "LocationMap[version=%d, entries=%d]".formatted(version, entries.size());
    }
}
