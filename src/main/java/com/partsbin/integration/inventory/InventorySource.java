package com.partsbin.integration.inventory;

import com.partsbin.core.catalog.InventoryRecord;

import java.io.IOException;
import java.util.List;

/**
 * Read side of the inventory system.
 */
public interface InventorySource {

    /**
     * Every component record the inventory system knows about.
     *
     * @throws IOException when the inventory cannot be read
     */
    List<InventoryRecord> fetchComponents() throws IOException;
}
