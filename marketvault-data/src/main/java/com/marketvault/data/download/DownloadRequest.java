package com.marketvault.data.download;

import com.marketvault.core.model.DataType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A batch of (symbol x sub-type) downloads for one data type over {@code [startDate, endDate)}.
 * Sub-type ids are validated and symbols deduplicated keeping their order.
 */
public record DownloadRequest(
    String exchange,
    DataType dataType,
    List<String> subTypeIds,
    Set<String> symbols,
    LocalDate startDate,
    LocalDate endDate
) {
    public DownloadRequest {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");

        List<String> resolved = new ArrayList<>();
        if (subTypeIds == null || subTypeIds.isEmpty()) {
            resolved.add(dataType.defaultSubTypeId());
        } else {
            for (String subTypeId : subTypeIds) {
                String id = dataType.resolveSubType(subTypeId);
                if (!resolved.contains(id)) {
                    resolved.add(id);
                }
            }
        }
        subTypeIds = List.copyOf(resolved);
        symbols = symbols == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
    }

    public static DownloadRequest of(String exchange, DataType dataType, String subTypeId, List<String> symbols,
                                     LocalDate startDate, LocalDate endDate) {
        return new DownloadRequest(exchange, dataType, subTypeId == null ? List.of() : List.of(subTypeId),
            new LinkedHashSet<>(symbols), startDate, endDate);
    }
}
