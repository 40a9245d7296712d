package com.sentinelmind.engine.models;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Журнал обучения агента: число взаимодействий, статистика по техникам,
 * уровень адаптации (только растет).
 */
@Getter
public class LearningProfile {
    
    private final String agentId;
    private int totalInteractions;
    private int adaptationLevel;
    private final Map<String, TechniqueStats> techniqueEffectiveness = new LinkedHashMap<>();
    
    public LearningProfile(String agentId) {
        this.agentId = agentId;
    }
    
    /**
     * @return новое значение totalInteractions
     */
    public int record(String technique, double effectiveness) {
        totalInteractions++;
        techniqueEffectiveness.computeIfAbsent(technique, t -> new TechniqueStats()).record(effectiveness);
        return totalInteractions;
    }
    
    public int incrementAdaptationLevel() {
        return ++adaptationLevel;
    }
    
    public Map<String, TechniqueStats> getTechniqueEffectiveness() {
        return Collections.unmodifiableMap(techniqueEffectiveness);
    }
    
    public LearningProfile snapshot() {
        LearningProfile copy = new LearningProfile(agentId);
        copy.totalInteractions = totalInteractions;
        copy.adaptationLevel = adaptationLevel;
        techniqueEffectiveness.forEach((technique, stats) ->
            copy.techniqueEffectiveness.put(technique, stats.copy()));
        return copy;
    }
}
