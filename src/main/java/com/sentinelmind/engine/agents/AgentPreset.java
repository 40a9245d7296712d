package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.models.AgentArchetype;
import com.sentinelmind.engine.models.AgentState;
import com.sentinelmind.engine.models.Difficulty;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Закрытая таблица пресетов агентов, ключ (архетип, сложность)
 */
@Getter
enum AgentPreset {
    SUSCEPTIBLE_EASY(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY,
        "Alex (Highly Susceptible)",
        "Trusting, imaginative, and eager to experience hypnosis",
        2, 3,
        List.of(),
        List.of("visualization", "relaxation", "trust"),
        10, 90, 50, "curious"),
    
    SUSCEPTIBLE_MEDIUM(AgentArchetype.SUSCEPTIBLE, Difficulty.MEDIUM,
        "Jordan (Moderately Susceptible)",
        "Open-minded but occasionally analytical",
        4, 5,
        List.of("pattern_recognition"),
        List.of("confusion", "fractionation"),
        30, 70, 60, "neutral"),
    
    RESISTANT_HARD(AgentArchetype.RESISTANT, Difficulty.HARD,
        "Morgan (Highly Resistant)",
        "Skeptical, analytical, and consciously resistant",
        7, 8,
        List.of("critical_thinking", "pattern_detection", "conscious_resistance"),
        List.of("overload", "double_binds"),
        80, 20, 90, "skeptical"),
    
    ADVERSARIAL_EXPERT(AgentArchetype.ADVERSARIAL, Difficulty.EXPERT,
        "Dr. Shadow (Master Hypnotist)",
        "Cunning, adaptive, uses advanced techniques",
        10, 10,
        List.of("rapid_induction", "covert_hypnosis", "nlp_mastery", "confusion_techniques"),
        List.of(),
        95, 5, 100, "focused");
    
    /** Пресет для неизвестных сочетаний архетипа и сложности */
    static final AgentPreset DEFAULT = SUSCEPTIBLE_EASY;
    
    private final AgentArchetype archetype;
    private final Difficulty difficulty;
    private final String displayName;
    private final String personality;
    private final int skillLevel;
    private final int adaptability;
    private final List<String> specialties;
    private final List<String> weaknesses;
    private final double resistance;
    private final double suggestibility;
    private final double awareness;
    private final String emotional;
    
    AgentPreset(AgentArchetype archetype, Difficulty difficulty, String displayName, String personality,
                int skillLevel, int adaptability, List<String> specialties, List<String> weaknesses,
                double resistance, double suggestibility, double awareness, String emotional) {
        this.archetype = archetype;
        this.difficulty = difficulty;
        this.displayName = displayName;
        this.personality = personality;
        this.skillLevel = skillLevel;
        this.adaptability = adaptability;
        this.specialties = specialties;
        this.weaknesses = weaknesses;
        this.resistance = resistance;
        this.suggestibility = suggestibility;
        this.awareness = awareness;
        this.emotional = emotional;
    }
    
    static Optional<AgentPreset> find(AgentArchetype archetype, Difficulty difficulty) {
        for (AgentPreset preset : values()) {
            if (preset.archetype == archetype && preset.difficulty == difficulty) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Новое начальное состояние (у каждого агента свой экземпляр)
     */
    AgentState initialState() {
        return AgentState.builder()
            .tranceDepth(0)
            .resistance(resistance)
            .suggestibility(suggestibility)
            .awareness(awareness)
            .emotional(emotional)
            .build();
    }
}
