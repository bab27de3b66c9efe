package com.marketvault.data.store;

import com.marketvault.core.model.DataType;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies one persisted partition.
 */
public record PartitionId(String exchange, DataType dataType, String subTypeId, String symbol,
                          LocalDate partitionKey) {

    public PartitionId {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(partitionKey, "partitionKey");
        subTypeId = dataType.resolveSubType(subTypeId);
    }

    @Override
    public String toString() {
        return exchange + "/" + dataType.id() + "/" + subTypeId + "/" + symbol + "/" + partitionKey;
    }
}
