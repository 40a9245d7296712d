package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.models.AgentArchetype;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.Difficulty;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Фабрика тренировочных агентов по пресетам.
 *
 * <p>Сочетание (архетип, сложность), для которого нет пресета,
 * получает пресет susceptible/easy; профиль тогда отражает фактически
 * примененный пресет, а не запрошенные значения.
 */
@Slf4j
public class AgentProfileFactory {
    
    private final Supplier<String> idGenerator;
    
    public AgentProfileFactory() {
        this(() -> "agent_" + UUID.randomUUID());
    }
    
    public AgentProfileFactory(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }
    
    public AgentProfile create(AgentArchetype archetype, Difficulty difficulty, boolean adaptiveLearning) {
        AgentPreset preset = AgentPreset.find(archetype, difficulty).orElseGet(() -> {
            log.warn("Нет пресета для {}/{}, используется {}/{}",
                archetype != null ? archetype.getValue() : null,
                difficulty != null ? difficulty.getValue() : null,
                AgentPreset.DEFAULT.getArchetype().getValue(),
                AgentPreset.DEFAULT.getDifficulty().getValue());
            return AgentPreset.DEFAULT;
        });
        
        return AgentProfile.builder()
            .id(idGenerator.get())
            .name(preset.getDisplayName())
            .archetype(preset.getArchetype())
            .difficulty(preset.getDifficulty())
            .personality(preset.getPersonality())
            .skillLevel(preset.getSkillLevel())
            .adaptability(preset.getAdaptability())
            .specialties(preset.getSpecialties())
            .weaknesses(preset.getWeaknesses())
            .adaptiveLearning(adaptiveLearning)
            .currentState(preset.initialState())
            .build();
    }
}
