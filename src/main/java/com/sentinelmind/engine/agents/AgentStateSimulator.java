package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.AgentResponse;
import com.sentinelmind.engine.models.AgentState;
import com.sentinelmind.engine.models.InteractionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Симулятор реакции агента на технику.
 * Единственный компонент, изменяющий AgentState. Вызывающий код обязан
 * сериализовать вызовы для одного агента (см. AgentRegistry).
 */
@Slf4j
public class AgentStateSimulator {
    
    static final double BASE_EFFECTIVENESS = 50;
    static final double LEARNED_RESISTANCE_BONUS = 20;
    static final double AWARENESS_PENALTY_WEIGHT = 20;
    static final double WEAKNESS_BONUS = 30;
    static final double SPECIALTY_PENALTY = 30;
    
    private static final double TRANCE_GAIN_THRESHOLD = 50;
    private static final double MIN_AWARENESS = 10;
    private static final double MAX_SUGGESTIBILITY = 95;
    
    private final Random random;
    private final Clock clock;
    
    public AgentStateSimulator(Random random) {
        this(random, Clock.systemUTC());
    }
    
    public AgentStateSimulator(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }
    
    public AgentResponse respond(AgentProfile agent, String technique, String content) {
        double effectiveness = calculateEffectiveness(agent, technique);
        ResponseTier tier = ResponseTier.forEffectiveness(effectiveness);
        
        AgentResponse response = AgentResponse.builder()
            .technique(technique)
            .verbal(pick(tier.getVerbal()))
            .physical(pick(tier.getPhysical()))
            .cognitive(pick(tier.getCognitive()))
            .effectiveness(effectiveness)
            .build();
        
        updateState(agent.getCurrentState(), effectiveness);
        
        agent.getCurrentState().appendHistory(InteractionRecord.builder()
            .timestamp(Instant.now(clock))
            .technique(technique)
            .effectiveness(effectiveness)
            .response(response.getVerbal())
            .build());
        
        log.debug("Агент {}: техника={}, эффективность={}, уровень={}, длина текста={}",
            agent.getId(), technique, effectiveness, tier, content != null ? content.length() : 0);
        
        return response;
    }
    
    /**
     * Эффективность техники для текущего состояния агента, в [0, 100]
     */
    public double calculateEffectiveness(AgentProfile agent, String technique) {
        AgentState state = agent.getCurrentState();
        double resistanceBonus = agent.resists(technique) ? LEARNED_RESISTANCE_BONUS : 0;
        
        double suggestibilityFactor = state.getSuggestibility() / 100;
        double resistanceFactor = (100 - state.getResistance() - resistanceBonus) / 100;
        double awarenessPenalty = (state.getAwareness() / 100) * AWARENESS_PENALTY_WEIGHT;
        
        double effectiveness = BASE_EFFECTIVENESS * suggestibilityFactor * resistanceFactor - awarenessPenalty;
        
        if (agent.hasWeakness(technique)) {
            effectiveness += WEAKNESS_BONUS;
        }
        
        if (agent.hasSpecialty("resist_" + technique)) {
            effectiveness -= SPECIALTY_PENALTY;
        }
        
        return Math.max(0, Math.min(100, effectiveness));
    }
    
    private void updateState(AgentState state, double effectiveness) {
        if (effectiveness > TRANCE_GAIN_THRESHOLD) {
            state.setTranceDepth(Math.min(100, state.getTranceDepth() + effectiveness / 10));
        }
        
        // awareness падает, suggestibility растет вместе с глубиной транса
        state.setAwareness(Math.max(MIN_AWARENESS, 100 - state.getTranceDepth()));
        state.setSuggestibility(Math.min(MAX_SUGGESTIBILITY, 30 + state.getTranceDepth() * 0.7));
        
        if (effectiveness > 70) {
            state.setEmotional("compliant");
        } else if (effectiveness > 40) {
            state.setEmotional("relaxed");
        } else if (effectiveness < 20) {
            state.setEmotional("resistant");
        }
    }
    
    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }
}
