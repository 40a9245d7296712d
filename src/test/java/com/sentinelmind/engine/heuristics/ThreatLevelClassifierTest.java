package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreatLevelClassifierTest {
    
    @Test
    void noDetectionsIsNone() {
        assertEquals(ThreatLevel.NONE, ThreatLevelClassifier.classify(List.of()));
        assertEquals(ThreatLevel.NONE, ThreatLevelClassifier.classify(null));
    }
    
    @Test
    void thresholdsAreExclusive() {
        assertEquals(ThreatLevel.NONE, ThreatLevelClassifier.classifyScore(20));
        assertEquals(ThreatLevel.LOW, ThreatLevelClassifier.classifyScore(21));
        assertEquals(ThreatLevel.LOW, ThreatLevelClassifier.classifyScore(40));
        assertEquals(ThreatLevel.MEDIUM, ThreatLevelClassifier.classifyScore(41));
        assertEquals(ThreatLevel.MEDIUM, ThreatLevelClassifier.classifyScore(60));
        assertEquals(ThreatLevel.HIGH, ThreatLevelClassifier.classifyScore(61));
        assertEquals(ThreatLevel.HIGH, ThreatLevelClassifier.classifyScore(80));
        assertEquals(ThreatLevel.CRITICAL, ThreatLevelClassifier.classifyScore(81));
    }
    
    @Test
    void usesMaximumScore() {
        List<DetectedThreat> threats = List.of(threat("a", 35), threat("b", 70), threat("c", 50));
        assertEquals(ThreatLevel.HIGH, ThreatLevelClassifier.classify(threats));
    }
    
    @Test
    void levelsAreOrdered() {
        assertTrue(ThreatLevel.CRITICAL.isAtLeast(ThreatLevel.HIGH));
        assertTrue(ThreatLevel.MEDIUM.isAtLeast(ThreatLevel.MEDIUM));
        assertFalse(ThreatLevel.LOW.isAtLeast(ThreatLevel.MEDIUM));
    }
    
    @Test
    void russianNames() {
        assertEquals("Критический", ThreatLevel.CRITICAL.getRussianName());
        assertEquals("Нет угрозы", ThreatLevel.NONE.getRussianName());
    }
    
    private static DetectedThreat threat(String type, int score) {
        return DetectedThreat.builder()
            .type(type)
            .pattern(type)
            .score(score)
            .confidence(Math.min(score / 100.0, 1.0))
            .build();
    }
}
