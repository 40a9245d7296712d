package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.AgentState;
import com.sentinelmind.engine.models.LearningProfile;
import com.sentinelmind.engine.models.TechniqueStats;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Журнал обучения агентов и цикл адаптации.
 *
 * <p>Каждое N-е взаимодействие агента запускает адаптацию: растет уровень адаптации,
 * а каждая техника со средней эффективностью выше порога поднимает сопротивление
 * агента на шаг (не выше потолка) и попадает в набор выученных сопротивлений.
 * Обновление журнала и адаптация выполняются под блокировкой агента из реестра.
 */
@Slf4j
public class AdaptiveLearningTracker {
    
    private final AgentRegistry registry;
    private final DefenseConfig.Learning settings;
    private final Map<String, LearningProfile> ledgers = new ConcurrentHashMap<>();
    
    public AdaptiveLearningTracker(AgentRegistry registry) {
        this(registry, DefenseConfig.defaults().getLearning());
    }
    
    public AdaptiveLearningTracker(AgentRegistry registry, DefenseConfig.Learning settings) {
        this.registry = registry;
        this.settings = settings;
    }
    
    /**
     * Завести пустой журнал для нового агента
     */
    public void open(String agentId) {
        ledgers.putIfAbsent(agentId, new LearningProfile(agentId));
    }
    
    /**
     * Записать взаимодействие; при необходимости адаптировать агента
     * @return true если в этом вызове сработала адаптация
     */
    public boolean recordInteraction(String agentId, String technique, double effectiveness) {
        return registry.withExclusive(agentId, agent -> {
            LearningProfile ledger = ledgers.computeIfAbsent(agentId, LearningProfile::new);
            int total = ledger.record(technique, effectiveness);
            
            if (total % settings.getAdaptationInterval() == 0 && agent.isAdaptiveLearning()) {
                adapt(agent, ledger);
                return true;
            }
            return false;
        });
    }
    
    /**
     * Снимок журнала агента
     */
    public LearningProfile getLearningProfile(String agentId) {
        return registry.withExclusive(agentId, agent ->
            ledgers.computeIfAbsent(agentId, LearningProfile::new).snapshot());
    }
    
    private void adapt(AgentProfile agent, LearningProfile ledger) {
        int level = ledger.incrementAdaptationLevel();
        AgentState state = agent.getCurrentState();
        double before = state.getResistance();
        
        for (Map.Entry<String, TechniqueStats> entry : ledger.getTechniqueEffectiveness().entrySet()) {
            if (entry.getValue().getAverageEffectiveness() > settings.getEffectiveTechniqueThreshold()) {
                if (state.getResistance() < settings.getResistanceCap()) {
                    state.setResistance(Math.min(settings.getResistanceCap(),
                        state.getResistance() + settings.getResistanceStep()));
                }
                agent.addResistancePattern(entry.getKey());
            }
        }
        
        log.info("Адаптация агента {}: уровень={}, сопротивление {} -> {}, выученные техники={}",
            agent.getId(), level, before, state.getResistance(), agent.getResistancePatterns());
    }
}
