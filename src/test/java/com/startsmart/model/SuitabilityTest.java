package com.startsmart.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SuitabilityTest {

    @Test
    void fromScore_shouldTakeHigherTierAtThreshold() {
        assertEquals(Suitability.EXCELLENT, Suitability.fromScore(0.80));
        assertEquals(Suitability.GOOD, Suitability.fromScore(0.7999));
        assertEquals(Suitability.GOOD, Suitability.fromScore(0.65));
        assertEquals(Suitability.MODERATE, Suitability.fromScore(0.45));
        assertEquals(Suitability.POOR, Suitability.fromScore(0.25));
        assertEquals(Suitability.NOT_RECOMMENDED, Suitability.fromScore(0.2499));
        assertEquals(Suitability.NOT_RECOMMENDED, Suitability.fromScore(0.0));
    }

    @Test
    void processingMode_shouldParseCaseInsensitivelyAndDefaultToFast() {
        assertEquals(ProcessingMode.FAST, ProcessingMode.parse(null));
        assertEquals(ProcessingMode.FAST, ProcessingMode.parse(" "));
        assertEquals(ProcessingMode.FULL, ProcessingMode.parse(" Full "));
        assertThrows(IllegalArgumentException.class, () -> ProcessingMode.parse("turbo"));
    }

    @Test
    void signalType_shouldIgnoreUnknownWireNames() {
        assertEquals(SignalType.COMPLAINT, SignalType.fromWire("Complaint"));
        assertEquals(null, SignalType.fromWire("repost"));
    }
}
