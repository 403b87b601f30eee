package com.partsbin.integration.inventory;

import com.partsbin.core.location.LocationMap;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import com.partsbin.logging.AppLogger;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Pushes the location map to the inventory system: every identity gets its primary slot as default
 * location, and stock on hand is moved there.
 */
public final class LocationSyncService {

    private static final Logger LOGGER = AppLogger.get();

    private final InventoryWriter writer;

    public LocationSyncService(InventoryWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * @param stock on-hand quantity per identity; identities without stock only get a default location
     * @throws SyncAbortedException when the inventory system stays unavailable; carries the operations already applied
     */
    public SyncReport sync(LocationMap locations, Map<ComponentIdentity, Integer> stock) throws SyncAbortedException {
        Objects.requireNonNull(locations, "locations");
        Objects.requireNonNull(stock, "stock");
        int defaults = 0;
        int moves = 0;
        for (Map.Entry<ComponentIdentity, List<StorageSlot>> entry : locations.entries().entrySet()) {
            ComponentIdentity identity = entry.getKey();
            StorageSlot primary = entry.getValue().get(0);
            try {
                writer.setDefaultLocation(identity, primary);
                defaults++;
                int quantity = stock.getOrDefault(identity, 0);
                if (quantity > 0) {
                    writer.moveStock(identity, primary, quantity);
                    moves++;
                }
            } catch (RemoteUnavailableException ex) {
                LOGGER.severe("Location sync aborted at %s after %d default location(s) and %d move(s)"
                    .formatted(identity.key(), defaults, moves));
                throw new SyncAbortedException(new SyncReport(defaults, moves), ex);
            } catch (IOException ex) {
                throw new SyncAbortedException(new SyncReport(defaults, moves),
                    new RemoteUnavailableException("sync " + identity.key(), 1, ex));
            }
        }
        LOGGER.info("Location sync applied %d default location(s) and %d stock move(s)".formatted(defaults, moves));
        return new SyncReport(defaults, moves);
    }

    /**
     * Operations applied by a sync run.
     */
    public record SyncReport(int defaultLocationsSet, int stockMoves) {

        public int operations() {
            return defaultLocationsSet + stockMoves;
        }
    }

    /**
     * A sync stopped because the inventory system became unavailable.
     */
    public static final class SyncAbortedException extends IOException {

        private final SyncReport applied;

        public SyncAbortedException(SyncReport applied, RemoteUnavailableException cause) {
            super("Location sync aborted after %d operation(s): %s".formatted(applied.operations(), cause.getMessage()), cause);
            this.applied = applied;
        }

        public SyncReport applied() {
            return applied;
        }

        public RemoteUnavailableException remoteCause() {
            return (RemoteUnavailableException) getCause();
        }
    }
}
