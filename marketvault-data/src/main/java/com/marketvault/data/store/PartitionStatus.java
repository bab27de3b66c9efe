package com.marketvault.data.store;

/**
 * What the store holds for one partition key.
 */
public enum PartitionStatus {
    ABSENT,
    COMPLETE_PRESENT,
    INCOMPLETE_PRESENT
}
