package com.sentinelmind.engine.core;

import com.sentinelmind.engine.agents.AdaptiveLearningTracker;
import com.sentinelmind.engine.agents.AgentProfileFactory;
import com.sentinelmind.engine.agents.AgentRegistry;
import com.sentinelmind.engine.agents.AgentStateSimulator;
import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.defense.DefenseProtocol;
import com.sentinelmind.engine.defense.EmergencyProtocolController;
import com.sentinelmind.engine.heuristics.ThreatDetector;
import com.sentinelmind.engine.knowledge.DefenseStrategyCatalog;
import com.sentinelmind.engine.knowledge.ThreatPatternCatalog;
import com.sentinelmind.engine.models.AgentArchetype;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.AgentResponse;
import com.sentinelmind.engine.models.DefenseAnalysis;
import com.sentinelmind.engine.models.DefenseMode;
import com.sentinelmind.engine.models.DefenseStrategy;
import com.sentinelmind.engine.models.Difficulty;
import com.sentinelmind.engine.models.EmergencyProtocol;
import com.sentinelmind.engine.models.GroundingResponse;
import com.sentinelmind.engine.models.LearningProfile;
import com.sentinelmind.engine.models.TechniqueOutcome;
import com.sentinelmind.engine.models.ThreatPattern;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Точка входа ядра для хост-приложения.
 *
 * <p>Анализ и экстренный протокол не имеют состояния. Агенты хранятся в памяти
 * процесса; вызовы для одного агента сериализуются его блокировкой, так что
 * обновление состояния, запись в журнал и адаптация видны снаружи как одно целое.
 */
@Slf4j
public class DefenseEngine {
    
    private final DefenseProtocol defenseProtocol;
    private final EmergencyProtocolController emergencyController;
    private final AgentProfileFactory profileFactory;
    private final AgentStateSimulator simulator;
    private final AgentRegistry registry;
    private final AdaptiveLearningTracker learningTracker;
    
    public DefenseEngine() {
        this(DefenseConfig.load());
    }
    
    public DefenseEngine(DefenseConfig config) {
        this(config, createRandom(config), Clock.systemDefaultZone());
    }
    
    public DefenseEngine(DefenseConfig config, Random random, Clock clock) {
        this(config, random, clock, new AgentProfileFactory());
    }
    
    public DefenseEngine(DefenseConfig config, Random random, Clock clock, AgentProfileFactory profileFactory) {
        this.defenseProtocol = new DefenseProtocol(new ThreatDetector(config.getDetection()));
        this.emergencyController = new EmergencyProtocolController(clock, config.getEmergency());
        this.profileFactory = profileFactory;
        this.simulator = new AgentStateSimulator(random, clock);
        this.registry = new AgentRegistry();
        this.learningTracker = new AdaptiveLearningTracker(registry, config.getLearning());
    }
    
    private static Random createRandom(DefenseConfig config) {
        Long seed = config.getSimulation().getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }
    
    // === Защита ===
    
    public DefenseAnalysis analyzeThreat(String input, DefenseMode mode) {
        return defenseProtocol.analyze(input, mode);
    }
    
    public DefenseAnalysis analyzeThreat(String input, String mode) {
        return analyzeThreat(input, DefenseMode.fromValue(mode));
    }
    
    public EmergencyProtocol activateEmergencyProtocol() {
        return emergencyController.activate();
    }
    
    public GroundingResponse groundingProtocol() {
        return emergencyController.groundingProtocol();
    }
    
    public List<ThreatPattern> listThreatPatterns() {
        return new ArrayList<>(ThreatPatternCatalog.all());
    }
    
    public List<DefenseStrategy> listDefenseStrategies() {
        return new ArrayList<>(DefenseStrategyCatalog.all());
    }
    
    // === Тренировочные агенты ===
    
    /**
     * @return снимок профиля нового агента
     */
    public AgentProfile createAgent(AgentArchetype archetype, Difficulty difficulty, boolean adaptiveLearning) {
        AgentProfile profile = profileFactory.create(archetype, difficulty, adaptiveLearning);
        AgentProfile created = profile.snapshot();
        registry.register(profile);
        learningTracker.open(profile.getId());
        
        log.info("Создан агент {} ({}/{}), адаптивное обучение: {}",
            profile.getId(), profile.getArchetype().getValue(), profile.getDifficulty().getValue(),
            adaptiveLearning);
        return created;
    }
    
    public AgentProfile createAgent(String archetype, String difficulty, boolean adaptiveLearning) {
        return createAgent(AgentArchetype.fromValue(archetype), Difficulty.fromValue(difficulty), adaptiveLearning);
    }
    
    /**
     * Применить технику к агенту: реакция, обновление состояния, запись в журнал обучения
     * @throws IllegalArgumentException если техника не указана
     * @throws AgentNotFoundException если агента нет
     */
    public AgentResponse respondToTechnique(String agentId, String technique, String content) {
        requireTechnique(technique);
        return registry.withExclusive(agentId, agent -> respondLocked(agent, technique, content));
    }
    
    /**
     * То же, что respondToTechnique, плюс снимок состояния, снятый под той же блокировкой
     */
    public TechniqueOutcome applyTechnique(String agentId, String technique, String content) {
        requireTechnique(technique);
        return registry.withExclusive(agentId, agent -> TechniqueOutcome.builder()
            .response(respondLocked(agent, technique, content))
            .state(agent.getCurrentState().snapshot())
            .build());
    }
    
    /**
     * Записать взаимодействие напрямую (воспроизведение/тесты)
     * @return true если сработала адаптация
     * @throws IllegalArgumentException если техника не указана
     * @throws AgentNotFoundException если агента нет
     */
    public boolean recordLearning(String agentId, String technique, double effectiveness) {
        requireTechnique(technique);
        return learningTracker.recordInteraction(agentId, technique, effectiveness);
    }
    
    /**
     * Снимок профиля агента; живой профиль наружу не отдается
     * @throws AgentNotFoundException если агента нет
     */
    public AgentProfile getAgent(String agentId) {
        return registry.withExclusive(agentId, AgentProfile::snapshot);
    }
    
    public LearningProfile getLearningProfile(String agentId) {
        return learningTracker.getLearningProfile(agentId);
    }
    
    private AgentResponse respondLocked(AgentProfile agent, String technique, String content) {
        AgentResponse response = simulator.respond(agent, technique, content);
        learningTracker.recordInteraction(agent.getId(), technique, response.getEffectiveness());
        return response;
    }
    
    private static void requireTechnique(String technique) {
        if (technique == null || technique.isBlank()) {
            throw new IllegalArgumentException("Не указана техника");
        }
    }
}
