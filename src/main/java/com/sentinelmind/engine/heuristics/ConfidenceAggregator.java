package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.models.DetectedThreat;

import java.util.List;

/**
 * Общая уверенность анализа (0-100): округленное среднее confidence обнаружений
 */
public class ConfidenceAggregator {
    
    private ConfidenceAggregator() {
    }
    
    public static int confidence(List<DetectedThreat> threats) {
        if (threats == null || threats.isEmpty()) {
            return 0;
        }
        
        double sum = 0;
        for (DetectedThreat threat : threats) {
            sum += threat.getConfidence();
        }
        double average = sum / threats.size();
        
        return (int) Math.min(100, Math.max(0, Math.round(average * 100)));
    }
}
