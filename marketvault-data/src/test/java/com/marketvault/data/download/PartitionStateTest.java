package com.marketvault.data.download;

import com.marketvault.data.store.PartitionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.marketvault.data.download.PartitionState.*;
import static org.junit.jupiter.api.Assertions.*;

class PartitionStateTest {

    @Test
    @DisplayName("Absent and incomplete partitions can start fetching")
    void startFetching() {
        assertEquals(FETCHING, ABSENT.transitionTo(FETCHING));
        assertEquals(FETCHING, INCOMPLETE.transitionTo(FETCHING));
        assertTrue(ABSENT.needsFetch());
        assertTrue(INCOMPLETE.needsFetch());
        assertFalse(COMPLETE.needsFetch());
    }

    @Test
    @DisplayName("Fetching ends complete, incomplete or back where it started")
    void finishFetching() {
        assertEquals(COMPLETE, FETCHING.transitionTo(COMPLETE));
        assertEquals(INCOMPLETE, FETCHING.transitionTo(INCOMPLETE));
        assertEquals(ABSENT, FETCHING.transitionTo(ABSENT));
    }

    @Test
    @DisplayName("Illegal transitions throw")
    void illegalTransitions() {
        assertThrows(IllegalStateException.class, () -> COMPLETE.transitionTo(FETCHING));
        assertThrows(IllegalStateException.class, () -> ABSENT.transitionTo(COMPLETE));
        assertThrows(IllegalStateException.class, () -> INCOMPLETE.transitionTo(COMPLETE));
        assertThrows(IllegalStateException.class, () -> FETCHING.transitionTo(FETCHING));
    }

    @Test
    @DisplayName("Store status maps onto states")
    void fromStatus() {
        assertEquals(ABSENT, PartitionState.of(PartitionStatus.ABSENT));
        assertEquals(INCOMPLETE, PartitionState.of(PartitionStatus.INCOMPLETE_PRESENT));
        assertEquals(COMPLETE, PartitionState.of(PartitionStatus.COMPLETE_PRESENT));
    }
}
