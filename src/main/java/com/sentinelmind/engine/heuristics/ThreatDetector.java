package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.knowledge.Indicator;
import com.sentinelmind.engine.knowledge.ThreatPatternCatalog;
import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatPattern;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Детектор манипулятивных паттернов.
 * Чистая функция: без состояния и без случайности, читает только неизменяемый каталог.
 */
@Slf4j
public class ThreatDetector {
    
    private final Collection<ThreatPattern> patterns;
    private final int keywordWeight;
    private final int indicatorWeight;
    private final int detectionThreshold;
    
    public ThreatDetector() {
        this(DefenseConfig.defaults().getDetection());
    }
    
    public ThreatDetector(DefenseConfig.Detection settings) {
        this(ThreatPatternCatalog.all(), settings);
    }
    
    ThreatDetector(Collection<ThreatPattern> patterns, DefenseConfig.Detection settings) {
        this.patterns = List.copyOf(patterns);
        this.keywordWeight = settings.getKeywordWeight();
        this.indicatorWeight = settings.getIndicatorWeight();
        this.detectionThreshold = settings.getDetectionThreshold();
    }
    
    /**
     * Найти угрозы во входном тексте
     * @return угрозы по убыванию score; при равенстве сохраняется порядок каталога
     */
    public List<DetectedThreat> detect(String input) {
        List<DetectedThreat> threats = new ArrayList<>();
        if (input == null || input.isBlank()) {
            return threats;
        }
        
        String lowercaseInput = input.toLowerCase(Locale.ROOT);
        
        for (ThreatPattern pattern : patterns) {
            int score = score(pattern, lowercaseInput);
            log.debug("Категория {}: score={}", pattern.getCategoryId(), score);
            
            if (score > detectionThreshold) {
                threats.add(DetectedThreat.builder()
                    .type(pattern.getCategoryId())
                    .pattern(pattern.getDescription())
                    .score(score)
                    .confidence(Math.min(score / 100.0, 1.0))
                    .build());
            }
        }
        
        // List.sort стабилен -> при равенстве остается порядок объявления
        threats.sort(Comparator.comparingInt(DetectedThreat::getScore).reversed());
        return threats;
    }
    
    /**
     * Очки одной категории для текста в нижнем регистре
     */
    int score(ThreatPattern pattern, String lowercaseInput) {
        int score = 0;
        
        for (String keyword : pattern.getKeywords()) {
            if (lowercaseInput.contains(keyword)) {
                score += keywordWeight;
            }
        }
        
        for (Indicator indicator : pattern.getIndicators()) {
            if (indicator.matches(lowercaseInput)) {
                score += indicatorWeight;
            }
        }
        
        return score;
    }
}
