package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatLevel;

import java.util.List;

/**
 * Классификация уровня угрозы по максимальному score
 */
public class ThreatLevelClassifier {
    
    private static final int CRITICAL_THRESHOLD = 80;
    private static final int HIGH_THRESHOLD = 60;
    private static final int MEDIUM_THRESHOLD = 40;
    private static final int LOW_THRESHOLD = 20;
    
    private ThreatLevelClassifier() {
    }
    
    public static ThreatLevel classify(List<DetectedThreat> threats) {
        if (threats == null || threats.isEmpty()) {
            return ThreatLevel.NONE;
        }
        
        int maxScore = threats.stream()
            .mapToInt(DetectedThreat::getScore)
            .max()
            .orElse(0);
        
        return classifyScore(maxScore);
    }
    
    public static ThreatLevel classifyScore(int score) {
        if (score > CRITICAL_THRESHOLD) return ThreatLevel.CRITICAL;
        if (score > HIGH_THRESHOLD) return ThreatLevel.HIGH;
        if (score > MEDIUM_THRESHOLD) return ThreatLevel.MEDIUM;
        if (score > LOW_THRESHOLD) return ThreatLevel.LOW;
        return ThreatLevel.NONE;
    }
}
