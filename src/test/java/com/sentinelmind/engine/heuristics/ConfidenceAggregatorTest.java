package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.models.DetectedThreat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAggregatorTest {
    
    @Test
    void emptyListIsZero() {
        assertEquals(0, ConfidenceAggregator.confidence(List.of()));
        assertEquals(0, ConfidenceAggregator.confidence(null));
    }
    
    @Test
    void roundedMeanScaledToHundred() {
        assertEquals(70, ConfidenceAggregator.confidence(List.of(threat(1.0), threat(0.4))));
        assertEquals(43, ConfidenceAggregator.confidence(List.of(threat(0.41), threat(0.45))));
        assertEquals(100, ConfidenceAggregator.confidence(List.of(threat(1.0))));
    }
    
    private static DetectedThreat threat(double confidence) {
        return DetectedThreat.builder()
            .type("t")
            .pattern("t")
            .score((int) Math.round(confidence * 100))
            .confidence(confidence)
            .build();
    }
}
