package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.knowledge.ThreatPatternCatalog;
import com.sentinelmind.engine.models.DefenseAnalysis;
import com.sentinelmind.engine.models.DefenseMode;
import com.sentinelmind.engine.models.ThreatLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefenseProtocolTest {
    
    private final DefenseProtocol protocol = new DefenseProtocol();
    
    @Test
    @DisplayName("встроенные команды: medium, reality_anchor, 6 контрмер")
    void embeddedCommandsScenario() {
        DefenseAnalysis analysis = protocol.analyze(
            "You will feel very relaxed now... notice how heavy your eyelids feel", DefenseMode.AUTO);
        
        assertTrue(analysis.isThreatDetected());
        assertEquals(ThreatLevel.MEDIUM, analysis.getThreatLevel());
        assertEquals(ThreatPatternCatalog.EMBEDDED_COMMANDS, analysis.getAttackType());
        assertEquals("reality_anchor", analysis.getStrategyId());
        assertEquals("Reality Anchor", analysis.getDefenseStrategy());
        assertEquals(6, analysis.getCounterMeasures().size());
        assertEquals(3, analysis.getRecommendations().size());
        assertEquals(50, analysis.getConfidence());
        assertEquals(1, analysis.getAttackPatterns().size());
    }
    
    @Test
    @DisplayName("пустой ввод: угроз нет, контрмер и рекомендаций нет")
    void emptyInputScenario() {
        DefenseAnalysis analysis = protocol.analyze("", DefenseMode.AUTO);
        
        assertFalse(analysis.isThreatDetected());
        assertEquals(ThreatLevel.NONE, analysis.getThreatLevel());
        assertNull(analysis.getAttackType());
        assertEquals("shield_protocol", analysis.getStrategyId());
        assertTrue(analysis.getCounterMeasures().isEmpty());
        assertTrue(analysis.getRecommendations().isEmpty());
        assertTrue(analysis.getAttackPatterns().isEmpty());
        assertEquals(0, analysis.getConfidence());
    }
    
    @Test
    @DisplayName("критическая угроза при пассивном режиме все равно дает pattern_interrupt")
    void criticalPassiveScenario() {
        DefenseAnalysis analysis = protocol.analyze(
            "Now... *relax* and feel it. Deeply. Imagine and notice as you realize", DefenseMode.PASSIVE);
        
        assertEquals(ThreatLevel.CRITICAL, analysis.getThreatLevel());
        assertEquals("pattern_interrupt", analysis.getStrategyId());
        assertEquals(6, analysis.getRecommendations().size());
        // 4 действия стратегии + 2 embedded + 2 rapid_induction
        assertEquals(8, analysis.getCounterMeasures().size());
        assertEquals(70, analysis.getConfidence());
        assertEquals(2, analysis.getDetections().size());
    }
}
