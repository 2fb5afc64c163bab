package com.previewenv.core.model;

import com.previewenv.core.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityRangeTest {

    private static final PriorityRange STEADY_STATE = new PriorityRange(101, 900);
    private static final PriorityRange PLATFORM = new PriorityRange(901, 1000);

    @Test
    void contains_shouldBeInclusiveOnBothEnds() {
        PriorityRange range = new PriorityRange(1, 100);

        assertTrue(range.contains(1));
        assertTrue(range.contains(100));
        assertFalse(range.contains(0));
        assertFalse(range.contains(101));
        assertEquals(100, range.size());
    }

    @Test
    void constructor_shouldRejectInvertedOrNonPositiveRanges() {
        assertThrows(InvalidConfigurationException.class, () -> new PriorityRange(10, 5));
        assertThrows(InvalidConfigurationException.class, () -> new PriorityRange(0, 5));
    }

    @Test
    void requireDisjointFrom_shouldAcceptPreviewRange() {
        assertDoesNotThrow(() -> new PriorityRange(1, 100).requireDisjointFrom(STEADY_STATE, PLATFORM));
    }

    @Test
    void requireDisjointFrom_shouldRejectOverlapWithSteadyState() {
        PriorityRange tooWide = new PriorityRange(1, 150);

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class,
            () -> tooWide.requireDisjointFrom(STEADY_STATE, PLATFORM));
        assertTrue(ex.getMessage().contains("[101, 900]"));
    }
}
