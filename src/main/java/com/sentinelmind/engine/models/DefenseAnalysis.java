package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат анализа входного текста
 */
@Data
@Builder
public class DefenseAnalysis {
    private boolean threatDetected;
    private ThreatLevel threatLevel;
    private String attackType; // null если угроз нет
    
    @Builder.Default
    private List<String> attackPatterns = new ArrayList<>();
    
    private String defenseStrategy; // отображаемое имя стратегии
    private String strategyId;
    
    @Builder.Default
    private List<String> counterMeasures = new ArrayList<>();
    
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
    
    private int confidence; // 0-100
    
    @Builder.Default
    private List<DetectedThreat> detections = new ArrayList<>();
}
