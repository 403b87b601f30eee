package com.partsbin.core.allocation;

import com.partsbin.core.catalog.CatalogMergeResult;
import com.partsbin.core.catalog.CatalogMerger;
import com.partsbin.core.catalog.InventoryRecord;
import com.partsbin.core.catalog.ReferenceRecord;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.location.LocationMap;
import com.partsbin.core.location.LocationMapStore;
import com.partsbin.logging.AppLogger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Merge, allocate and persist in one step. Source records are fetched by the caller before this
 * runs, so a failing inventory system never reaches the store.
 */
public final class AllocationPipeline {

    private static final Logger LOGGER = AppLogger.get();

    private final CatalogMerger merger;
    private final AllocationEngine engine;
    private final LocationMapStore store;

    public AllocationPipeline(CatalogMerger merger, AllocationEngine engine, LocationMapStore store) {
        this.merger = Objects.requireNonNull(merger, "merger");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
    }

    public Outcome run(Collection<InventoryRecord> inventory,
                       Collection<ReferenceRecord> reference,
                       AllocationTopology topology) throws IOException {
        CatalogMergeResult merged = merger.merge(inventory, reference);
        AtomicReference<AllocationResult> allocation = new AtomicReference<>();
        LocationMap written = store.extend(current -> {
            AllocationResult result = engine.allocate(merged.specs(), topology, current);
            allocation.set(result);
            return result.locationMap();
        });
        AllocationResult result = allocation.get();
        List<StorageIssue> issues = new ArrayList<>(merged.issues());
        issues.addAll(result.issues());
        LOGGER.info("Allocation run: %d component types, %d new placement(s), map version %d"
            .formatted(merged.specs().size(), result.added().size(), written.version()));
        return new Outcome(merged, result, written, issues);
    }

    /**
     * Everything one run produced.
     *
     * @param catalog    merged catalog
     * @param allocation allocation computed against the map that was current under the lock
     * @param persisted  the map now on disk
     * @param issues     merge and allocation issues together
     */
    public record Outcome(CatalogMergeResult catalog,
                          AllocationResult allocation,
                          LocationMap persisted,
                          List<StorageIssue> issues) {

        public Outcome {
            issues = List.copyOf(issues);
        }

        public boolean needsReview() {
            return issues.stream().anyMatch(issue -> issue.type().requiresReview());
        }
    }
}
