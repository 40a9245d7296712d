package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.knowledge.DefenseStrategyCatalog;
import com.sentinelmind.engine.models.DefenseMode;
import com.sentinelmind.engine.models.DefenseStrategy;
import com.sentinelmind.engine.models.ThreatLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Выбор защитной стратегии по уровню угрозы и режиму.
 *
 * <p>Порядок правил (срабатывает первое подходящее):
 * <ol>
 *   <li>AGGRESSIVE или CRITICAL -> pattern_interrupt, независимо от остального;</li>
 *   <li>PASSIVE или LOW -> shield_protocol;</li>
 *   <li>AUTO: таблица по уровню, по умолчанию reality_anchor.</li>
 * </ol>
 * Поэтому CRITICAL при режиме PASSIVE все равно дает pattern_interrupt.
 * В таблице AUTO нет ключа CRITICAL: этот уровень целиком поглощается правилом 1.
 */
public class StrategySelector {
    
    private static final Map<ThreatLevel, String> AUTO_TABLE;
    
    static {
        Map<ThreatLevel, String> table = new EnumMap<>(ThreatLevel.class);
        table.put(ThreatLevel.HIGH, DefenseStrategyCatalog.CONSCIOUS_ANALYSIS);
        table.put(ThreatLevel.MEDIUM, DefenseStrategyCatalog.REALITY_ANCHOR);
        table.put(ThreatLevel.LOW, DefenseStrategyCatalog.SHIELD_PROTOCOL);
        table.put(ThreatLevel.NONE, DefenseStrategyCatalog.SHIELD_PROTOCOL);
        AUTO_TABLE = Collections.unmodifiableMap(table);
    }
    
    private StrategySelector() {
    }
    
    public static DefenseStrategy select(ThreatLevel level, DefenseMode mode) {
        ThreatLevel effectiveLevel = level != null ? level : ThreatLevel.NONE;
        DefenseMode effectiveMode = mode != null ? mode : DefenseMode.AUTO;
        
        if (effectiveMode == DefenseMode.AGGRESSIVE || effectiveLevel == ThreatLevel.CRITICAL) {
            return DefenseStrategyCatalog.require(DefenseStrategyCatalog.PATTERN_INTERRUPT);
        }
        
        if (effectiveMode == DefenseMode.PASSIVE || effectiveLevel == ThreatLevel.LOW) {
            return DefenseStrategyCatalog.require(DefenseStrategyCatalog.SHIELD_PROTOCOL);
        }
        
        String strategyId = AUTO_TABLE.getOrDefault(effectiveLevel, DefenseStrategyCatalog.REALITY_ANCHOR);
        return DefenseStrategyCatalog.require(strategyId);
    }
}
