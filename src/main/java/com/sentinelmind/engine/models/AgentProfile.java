package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Профиль тренировочного агента.
 * specialties/weaknesses неизменяемы после создания; состояние и
 * набор выученных сопротивлений меняются только симулятором и трекером обучения.
 */
@Getter
public class AgentProfile {
    
    private final String id;
    private final String name;
    private final AgentArchetype archetype;
    private final Difficulty difficulty;
    private final String personality;
    private final int skillLevel; // 1-10
    private final int adaptability; // 1-10
    private final List<String> specialties;
    private final List<String> weaknesses;
    private final boolean adaptiveLearning;
    private final AgentState currentState;
    
    private final Set<String> resistancePatterns = new LinkedHashSet<>();
    
    @Builder
    private AgentProfile(String id, String name, AgentArchetype archetype, Difficulty difficulty,
                         String personality, int skillLevel, int adaptability,
                         List<String> specialties, List<String> weaknesses,
                         boolean adaptiveLearning, AgentState currentState) {
        this.id = id;
        this.name = name;
        this.archetype = archetype;
        this.difficulty = difficulty;
        this.personality = personality;
        this.skillLevel = skillLevel;
        this.adaptability = adaptability;
        this.specialties = specialties != null ? List.copyOf(specialties) : List.of();
        this.weaknesses = weaknesses != null ? List.copyOf(weaknesses) : List.of();
        this.adaptiveLearning = adaptiveLearning;
        this.currentState = currentState;
    }
    
    public boolean hasWeakness(String technique) {
        return weaknesses.contains(technique);
    }
    
    public boolean hasSpecialty(String specialty) {
        return specialties.contains(specialty);
    }
    
    public boolean resists(String technique) {
        return resistancePatterns.contains(technique);
    }
    
    public void addResistancePattern(String technique) {
        resistancePatterns.add(technique);
    }
    
    public Set<String> getResistancePatterns() {
        return Collections.unmodifiableSet(resistancePatterns);
    }
    
    /**
     * Отсоединенная копия профиля вместе с состоянием и выученными сопротивлениями.
     * Снимать под блокировкой агента.
     */
    public AgentProfile snapshot() {
        AgentProfile copy = new AgentProfile(id, name, archetype, difficulty, personality, skillLevel,
            adaptability, specialties, weaknesses, adaptiveLearning,
            currentState != null ? currentState.snapshot() : null);
        copy.resistancePatterns.addAll(resistancePatterns);
        return copy;
    }
}
