package com.partsbin.integration.inventory;

import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;

import java.io.IOException;

/**
 * Write side of the inventory system. Both operations are idempotent on the remote end, so they
 * may be retried.
 */
public interface InventoryWriter {

    void setDefaultLocation(ComponentIdentity identity, StorageSlot slot) throws IOException;

    void moveStock(ComponentIdentity identity, StorageSlot slot, int quantity) throws IOException;
}
