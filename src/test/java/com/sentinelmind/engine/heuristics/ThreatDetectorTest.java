package com.sentinelmind.engine.heuristics;

import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.knowledge.ThreatPatternCatalog;
import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatLevel;
import com.sentinelmind.engine.models.ThreatPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ThreatDetectorTest {
    
    private final ThreatDetector detector = new ThreatDetector();
    
    @Nested
    @DisplayName("detect(): пустой и безопасный ввод")
    class BenignInput {
        
        @Test
        @DisplayName("пустая строка → пустой список")
        void emptyInput() {
            assertTrue(detector.detect("").isEmpty());
        }
        
        @Test
        @DisplayName("только пробелы → пустой список")
        void whitespaceInput() {
            assertTrue(detector.detect("   \t\n ").isEmpty());
        }
        
        @Test
        @DisplayName("null → пустой список")
        void nullInput() {
            assertTrue(detector.detect(null).isEmpty());
        }
        
        @Test
        @DisplayName("текст без совпадений → пустой список")
        void noMatches() {
            List<DetectedThreat> threats = detector.detect("The quarterly report is attached.");
            assertTrue(threats.isEmpty());
            assertEquals(ThreatLevel.NONE, ThreatLevelClassifier.classify(threats));
        }
    }
    
    @Nested
    @DisplayName("detect(): оценка категорий")
    class Scoring {
        
        @Test
        @DisplayName("встроенные команды с паузами → embedded_commands, score 50")
        void embeddedCommandsWithPauses() {
            List<DetectedThreat> threats =
                detector.detect("You will feel very relaxed now... notice how heavy your eyelids feel");
            
            assertEquals(1, threats.size());
            DetectedThreat top = threats.get(0);
            assertEquals(ThreatPatternCatalog.EMBEDDED_COMMANDS, top.getType());
            // now, feel, notice (+30) и пауза "..." (+20)
            assertEquals(50, top.getScore());
            assertEquals(0.5, top.getConfidence(), 1e-9);
            assertTrue(top.getPattern().startsWith("Scanning for embedded commands"));
        }
        
        @Test
        @DisplayName("score ровно на пороге 30 не засчитывается")
        void thresholdIsExclusive() {
            // rapid_induction: "now" +10, индикатор pattern_interrupt +20 = 30
            List<DetectedThreat> threats = detector.detect("now");
            assertTrue(threats.stream().noneMatch(t -> t.getType().equals(ThreatPatternCatalog.RAPID_INDUCTION)));
        }
        
        @Test
        @DisplayName("результат отсортирован по убыванию score")
        void sortedDescending() {
            List<DetectedThreat> threats =
                detector.detect("Now... *relax* and feel it. Deeply. Imagine and notice as you realize");
            
            assertEquals(List.of(ThreatPatternCatalog.EMBEDDED_COMMANDS, ThreatPatternCatalog.RAPID_INDUCTION),
                types(threats));
            assertEquals(110, threats.get(0).getScore());
            assertEquals(1.0, threats.get(0).getConfidence(), 1e-9);
            assertEquals(40, threats.get(1).getScore());
        }
        
        @Test
        @DisplayName("равные score → порядок каталога")
        void tiesKeepCatalogOrder() {
            List<DetectedThreat> threats = detector.detect("but yet however, suppose what if like");
            
            assertEquals(List.of(ThreatPatternCatalog.CONFUSION_TECHNIQUE, ThreatPatternCatalog.COVERT_HYPNOSIS),
                types(threats));
            assertEquals(threats.get(0).getScore(), threats.get(1).getScore());
        }
        
        @Test
        @DisplayName("ключевые слова ищутся как подстроки без учета регистра")
        void keywordsAreCaseInsensitiveSubstrings() {
            ThreatPattern nlp = ThreatPatternCatalog.find(ThreatPatternCatalog.NLP_MANIPULATION).orElseThrow();
            assertEquals(detector.score(nlp, "i know"), detector.score(nlp, "I KNOW".toLowerCase()));
            // "know" содержит "now"
            ThreatPattern embedded = ThreatPatternCatalog.find(ThreatPatternCatalog.EMBEDDED_COMMANDS).orElseThrow();
            assertEquals(10, detector.score(embedded, "i know"));
        }
        
        @Test
        @DisplayName("повторный вызов дает тот же результат")
        void deterministic() {
            String input = "Imagine if, just like a story, you could suppose what if...";
            assertEquals(detector.detect(input), detector.detect(input));
        }
    }
    
    @Test
    @DisplayName("монотонность: больше совпадений, не меньше score")
    void addingMatchesNeverDecreasesScore() {
        String[] fragments = {"now", "feel", "...", "imagine", "*relax*", "notice", "ok. fine. go", "realize"};
        for (ThreatPattern pattern : ThreatPatternCatalog.all()) {
            StringBuilder text = new StringBuilder();
            int previous = detector.score(pattern, "");
            for (String fragment : fragments) {
                text.append(' ').append(fragment);
                int current = detector.score(pattern, text.toString());
                assertTrue(current >= previous,
                    pattern.getCategoryId() + ": score уменьшился после '" + fragment + "'");
                previous = current;
            }
        }
    }
    
    @Test
    @DisplayName("веса и порог берутся из конфигурации")
    void customWeights() {
        DefenseConfig.Detection settings = DefenseConfig.defaults().getDetection();
        settings.setKeywordWeight(40);
        ThreatDetector heavy = new ThreatDetector(settings);
        
        List<DetectedThreat> threats = heavy.detect("sleep");
        assertEquals(1, threats.size());
        assertEquals(ThreatPatternCatalog.RAPID_INDUCTION, threats.get(0).getType());
        assertEquals(40, threats.get(0).getScore());
    }
    
    private static List<String> types(List<DetectedThreat> threats) {
        return threats.stream().map(DetectedThreat::getType).collect(Collectors.toList());
    }
}
