package com.marketvault.data.download;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketvault.core.model.DataType;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-window outcome of one {@link FetchOrchestrator#download} call.
 * Failures and out-of-range warnings are listed here instead of being thrown.
 */
public record DownloadSummary(
    String exchange,
    DataType dataType,
    LocalDate startDate,
    LocalDate endDate,
    List<WindowResult> results
) {
    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public DownloadSummary {
        results = List.copyOf(results);
    }

    public int fetchedCount() {
        return count(WindowStatus.FETCHED);
    }

    public int skippedCount() {
        return count(WindowStatus.SKIPPED);
    }

    public int failedCount() {
        return count(WindowStatus.FAILED);
    }

    public int warningCount() {
        return count(WindowStatus.OUT_OF_RANGE);
    }

    public int cancelledCount() {
        return count(WindowStatus.CANCELLED);
    }

    public List<WindowResult> failures() {
        return withStatus(WindowStatus.FAILED);
    }

    public List<WindowResult> warnings() {
        return withStatus(WindowStatus.OUT_OF_RANGE);
    }

    public List<WindowResult> withStatus(WindowStatus status) {
        return results.stream().filter(r -> r.status() == status).toList();
    }

    private int count(WindowStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    /**
     * Pretty-printed JSON report.
     */
    public String toJson() throws JsonProcessingException {
        return JSON.writeValueAsString(this);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s..%s: %d fetched, %d skipped, %d failed, %d warnings, %d cancelled",
            exchange, dataType.id(), startDate, endDate, fetchedCount(), skippedCount(), failedCount(),
            warningCount(), cancelledCount());
    }
}
