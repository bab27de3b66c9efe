package com.marketvault.data.store;

import java.io.IOException;

/**
 * Thrown when reading a partition that has not been persisted.
 */
public class PartitionNotFoundException extends IOException {

    private final PartitionId partitionId;

    public PartitionNotFoundException(PartitionId partitionId) {
        super("Partition not found: " + partitionId);
        this.partitionId = partitionId;
    }

    public PartitionId getPartitionId() {
        return partitionId;
    }
}
