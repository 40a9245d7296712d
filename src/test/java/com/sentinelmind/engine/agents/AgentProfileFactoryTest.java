package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.models.AgentArchetype;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.AgentState;
import com.sentinelmind.engine.models.Difficulty;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AgentProfileFactoryTest {
    
    private final AtomicInteger sequence = new AtomicInteger();
    private final AgentProfileFactory factory =
        new AgentProfileFactory(() -> "agent_" + sequence.incrementAndGet());
    
    @Test
    void resistantHardPreset() {
        AgentProfile agent = factory.create(AgentArchetype.RESISTANT, Difficulty.HARD, true);
        AgentState state = agent.getCurrentState();
        
        assertEquals("agent_1", agent.getId());
        assertTrue(agent.getName().startsWith("Morgan"));
        assertEquals(AgentArchetype.RESISTANT, agent.getArchetype());
        assertEquals(Difficulty.HARD, agent.getDifficulty());
        assertEquals(80, state.getResistance());
        assertEquals(20, state.getSuggestibility());
        assertEquals(90, state.getAwareness());
        assertEquals(0, state.getTranceDepth());
        assertEquals("skeptical", state.getEmotional());
        assertEquals(List.of("overload", "double_binds"), agent.getWeaknesses());
        assertEquals(7, agent.getSkillLevel());
        assertEquals(8, agent.getAdaptability());
        assertTrue(agent.getResistancePatterns().isEmpty());
        assertTrue(state.getHistory().isEmpty());
        assertTrue(agent.isAdaptiveLearning());
    }
    
    @Test
    void adversarialExpertHasNoWeaknesses() {
        AgentProfile agent = factory.create(AgentArchetype.ADVERSARIAL, Difficulty.EXPERT, false);
        
        assertTrue(agent.getWeaknesses().isEmpty());
        assertTrue(agent.hasSpecialty("rapid_induction"));
        assertEquals(95, agent.getCurrentState().getResistance());
        assertEquals(100, agent.getCurrentState().getAwareness());
        assertFalse(agent.isAdaptiveLearning());
    }
    
    @Test
    void unknownCombinationFallsBackToSusceptibleEasy() {
        AgentProfile agent = factory.create(AgentArchetype.RESISTANT, Difficulty.EASY, true);
        
        assertEquals(AgentArchetype.SUSCEPTIBLE, agent.getArchetype());
        assertEquals(Difficulty.EASY, agent.getDifficulty());
        assertEquals(10, agent.getCurrentState().getResistance());
        assertEquals(90, agent.getCurrentState().getSuggestibility());
        assertTrue(agent.hasWeakness("relaxation"));
    }
    
    @Test
    void offensiveIsAliasForAdversarial() {
        AgentProfile agent = factory.create(
            AgentArchetype.fromValue("offensive"), Difficulty.fromValue("expert"), true);
        assertTrue(agent.getName().startsWith("Dr. Shadow"));
    }
    
    @Test
    void agentsDoNotShareState() {
        AgentProfile first = factory.create(AgentArchetype.SUSCEPTIBLE, Difficulty.MEDIUM, true);
        AgentProfile second = factory.create(AgentArchetype.SUSCEPTIBLE, Difficulty.MEDIUM, true);
        
        first.getCurrentState().setResistance(99);
        
        assertNotEquals(first.getId(), second.getId());
        assertEquals(30, second.getCurrentState().getResistance());
    }
    
    @Test
    void defaultIdsArePrefixed() {
        AgentProfile agent = new AgentProfileFactory().create(AgentArchetype.SUSCEPTIBLE, Difficulty.EASY, true);
        assertTrue(agent.getId().startsWith("agent_"));
    }
}
