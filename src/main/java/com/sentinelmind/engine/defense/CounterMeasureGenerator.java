package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.knowledge.ThreatPatternCatalog;
import com.sentinelmind.engine.models.DefenseStrategy;
import com.sentinelmind.engine.models.DetectedThreat;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сборка контрмер: действия стратегии + контрмеры по каждой обнаруженной категории.
 * Дубликаты убираются с сохранением порядка первого появления.
 */
public class CounterMeasureGenerator {
    
    private static final Map<String, List<String>> CATEGORY_COUNTERS = Map.of(
        ThreatPatternCatalog.EMBEDDED_COMMANDS, List.of(
            "Consciously reject embedded suggestions",
            "Repeat \"I choose my own thoughts\""),
        ThreatPatternCatalog.CONFUSION_TECHNIQUE, List.of(
            "Focus on one simple fact",
            "Count backwards from 10"),
        ThreatPatternCatalog.RAPID_INDUCTION, List.of(
            "Keep eyes open and focused",
            "Tense muscles deliberately"),
        ThreatPatternCatalog.COVERT_HYPNOSIS, List.of(
            "Interrupt the story",
            "Ask direct questions"),
        ThreatPatternCatalog.NLP_MANIPULATION, List.of(
            "Break rapport deliberately",
            "Use different sensory language")
    );
    
    private CounterMeasureGenerator() {
    }
    
    public static List<String> generate(List<DetectedThreat> threats, DefenseStrategy strategy) {
        Set<String> measures = new LinkedHashSet<>();
        
        if (strategy != null) {
            measures.addAll(strategy.getExecution());
        }
        
        if (threats != null) {
            for (DetectedThreat threat : threats) {
                measures.addAll(countersFor(threat.getType()));
            }
        }
        
        return new ArrayList<>(measures);
    }
    
    /**
     * Контрмеры категории; для неизвестной категории пустой список
     */
    public static List<String> countersFor(String categoryId) {
        if (categoryId == null) {
            return List.of();
        }
        return CATEGORY_COUNTERS.getOrDefault(categoryId, List.of());
    }
}
