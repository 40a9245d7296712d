package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.core.AgentNotFoundException;
import com.sentinelmind.engine.models.AgentArchetype;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.Difficulty;
import com.sentinelmind.engine.models.LearningProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveLearningTrackerTest {
    
    private AgentRegistry registry;
    private AdaptiveLearningTracker tracker;
    private AgentProfileFactory factory;
    
    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
        tracker = new AdaptiveLearningTracker(registry);
        factory = new AgentProfileFactory();
    }
    
    private AgentProfile register(AgentArchetype archetype, Difficulty difficulty, boolean adaptive) {
        AgentProfile agent = factory.create(archetype, difficulty, adaptive);
        registry.register(agent);
        tracker.open(agent.getId());
        return agent;
    }
    
    @Test
    @DisplayName("5 эффективных применений → сопротивление +5 и выученная техника")
    void adaptationAfterFiveEffectiveInteractions() {
        AgentProfile agent = register(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, true);
        
        for (int i = 1; i <= 4; i++) {
            assertFalse(tracker.recordInteraction(agent.getId(), "relaxation", 85));
        }
        assertEquals(10, agent.getCurrentState().getResistance());
        
        assertTrue(tracker.recordInteraction(agent.getId(), "relaxation", 85));
        
        assertEquals(15, agent.getCurrentState().getResistance());
        assertEquals(Set.of("relaxation"), agent.getResistancePatterns());
        
        LearningProfile ledger = tracker.getLearningProfile(agent.getId());
        assertEquals(5, ledger.getTotalInteractions());
        assertEquals(1, ledger.getAdaptationLevel());
        assertEquals(5, ledger.getTechniqueEffectiveness().get("relaxation").getCount());
        assertEquals(85, ledger.getTechniqueEffectiveness().get("relaxation").getAverageEffectiveness(), 1e-9);
    }
    
    @Test
    @DisplayName("средняя эффективность ровно 70 не считается эффективной")
    void thresholdIsExclusive() {
        AgentProfile agent = register(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, true);
        
        for (int i = 0; i < 5; i++) {
            tracker.recordInteraction(agent.getId(), "trust", 70);
        }
        
        assertEquals(10, agent.getCurrentState().getResistance());
        assertTrue(agent.getResistancePatterns().isEmpty());
        assertEquals(1, tracker.getLearningProfile(agent.getId()).getAdaptationLevel());
    }
    
    @Test
    @DisplayName("каждая эффективная техника дает свой шаг")
    void oneStepPerEffectiveTechnique() {
        AgentProfile agent = register(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, true);
        
        tracker.recordInteraction(agent.getId(), "relaxation", 90);
        tracker.recordInteraction(agent.getId(), "trust", 80);
        tracker.recordInteraction(agent.getId(), "confusion", 10);
        tracker.recordInteraction(agent.getId(), "relaxation", 90);
        tracker.recordInteraction(agent.getId(), "trust", 80);
        
        assertEquals(20, agent.getCurrentState().getResistance());
        assertEquals(Set.of("relaxation", "trust"), agent.getResistancePatterns());
    }
    
    @Test
    @DisplayName("сопротивление не превышает потолок 95")
    void resistanceCap() {
        AgentProfile agent = register(AgentArchetype.ADVERSARIAL, Difficulty.EXPERT, true);
        
        for (int i = 0; i < 10; i++) {
            tracker.recordInteraction(agent.getId(), "pattern_interrupt", 99);
        }
        
        assertEquals(95, agent.getCurrentState().getResistance());
        assertTrue(agent.resists("pattern_interrupt"));
        assertEquals(2, tracker.getLearningProfile(agent.getId()).getAdaptationLevel());
    }
    
    @Test
    @DisplayName("шаг обрезается на потолке")
    void stepTruncatedAtCap() {
        AgentProfile agent = register(AgentArchetype.RESISTANT, Difficulty.HARD, true);
        agent.getCurrentState().setResistance(93);
        
        for (int i = 0; i < 5; i++) {
            tracker.recordInteraction(agent.getId(), "overload", 90);
        }
        
        assertEquals(95, agent.getCurrentState().getResistance());
    }
    
    @Test
    @DisplayName("при выключенном обучении журнал ведется, но адаптации нет")
    void adaptiveLearningDisabled() {
        AgentProfile agent = register(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, false);
        
        for (int i = 0; i < 10; i++) {
            assertFalse(tracker.recordInteraction(agent.getId(), "relaxation", 95));
        }
        
        LearningProfile ledger = tracker.getLearningProfile(agent.getId());
        assertEquals(10, ledger.getTotalInteractions());
        assertEquals(0, ledger.getAdaptationLevel());
        assertEquals(10, agent.getCurrentState().getResistance());
        assertTrue(agent.getResistancePatterns().isEmpty());
    }
    
    @Test
    void snapshotIsDetached() {
        AgentProfile agent = register(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, true);
        tracker.recordInteraction(agent.getId(), "relaxation", 50);
        
        LearningProfile snapshot = tracker.getLearningProfile(agent.getId());
        tracker.recordInteraction(agent.getId(), "relaxation", 50);
        
        assertEquals(1, snapshot.getTotalInteractions());
        assertEquals(1, snapshot.getTechniqueEffectiveness().get("relaxation").getCount());
        assertEquals(2, tracker.getLearningProfile(agent.getId()).getTotalInteractions());
    }
    
    @Test
    void unknownAgent() {
        AgentNotFoundException e = assertThrows(AgentNotFoundException.class,
            () -> tracker.recordInteraction("agent_missing", "relaxation", 50));
        assertEquals("agent_missing", e.getAgentId());
        assertThrows(AgentNotFoundException.class, () -> tracker.getLearningProfile("agent_missing"));
    }
}
