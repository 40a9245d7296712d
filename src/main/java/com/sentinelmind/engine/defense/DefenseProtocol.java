package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.heuristics.ConfidenceAggregator;
import com.sentinelmind.engine.heuristics.ThreatDetector;
import com.sentinelmind.engine.heuristics.ThreatLevelClassifier;
import com.sentinelmind.engine.models.DefenseAnalysis;
import com.sentinelmind.engine.models.DefenseMode;
import com.sentinelmind.engine.models.DefenseStrategy;
import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Анализ текста: обнаружение -> уровень -> стратегия -> контрмеры -> рекомендации.
 * Без состояния, безопасен для параллельных вызовов.
 */
@Slf4j
public class DefenseProtocol {
    
    private final ThreatDetector detector;
    
    public DefenseProtocol() {
        this(new ThreatDetector());
    }
    
    public DefenseProtocol(ThreatDetector detector) {
        this.detector = detector;
    }
    
    public DefenseAnalysis analyze(String input, DefenseMode mode) {
        List<DetectedThreat> threats = detector.detect(input);
        ThreatLevel threatLevel = ThreatLevelClassifier.classify(threats);
        
        DefenseStrategy strategy = StrategySelector.select(threatLevel, mode);
        List<String> counterMeasures = threats.isEmpty()
            ? List.of()
            : CounterMeasureGenerator.generate(threats, strategy);
        
        DefenseAnalysis analysis = DefenseAnalysis.builder()
            .threatDetected(!threats.isEmpty())
            .threatLevel(threatLevel)
            .attackType(threats.isEmpty() ? null : threats.get(0).getType())
            .attackPatterns(threats.stream()
                .map(DetectedThreat::getPattern)
                .collect(Collectors.toList()))
            .defenseStrategy(strategy.getName())
            .strategyId(strategy.getId())
            .counterMeasures(counterMeasures)
            .recommendations(RecommendationGenerator.recommend(threatLevel, threats))
            .confidence(ConfidenceAggregator.confidence(threats))
            .detections(threats)
            .build();
        
        if (analysis.isThreatDetected()) {
            log.info("Обнаружена угроза: уровень={}, категория={}, стратегия={}",
                threatLevel.getValue(), analysis.getAttackType(), strategy.getId());
        } else {
            log.debug("Угроз не обнаружено");
        }
        
        return analysis;
    }
}
