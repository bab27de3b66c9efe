package com.marketvault.data.download;

/**
 * Outcome of one planned window.
 */
public enum WindowStatus {
    /** Fetched and committed. */
    FETCHED,
    /** Already complete on disk, no request made. */
    SKIPPED,
    /** Fetch or commit failed; prior on-disk state left untouched. */
    FAILED,
    /** Past window for which the exchange returned nothing. Not committed. */
    OUT_OF_RANGE,
    /** Not dispatched because the download was cancelled. */
    CANCELLED
}
