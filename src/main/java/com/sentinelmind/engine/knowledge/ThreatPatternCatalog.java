package com.sentinelmind.engine.knowledge;

import com.sentinelmind.engine.models.ThreatPattern;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * База известных категорий атак.
 * Заполняется один раз при загрузке класса, порядок объявления фиксирован
 * (он же используется для разрешения равенства очков в детекторе).
 */
public final class ThreatPatternCatalog {
    
    public static final String EMBEDDED_COMMANDS = "embedded_commands";
    public static final String CONFUSION_TECHNIQUE = "confusion_technique";
    public static final String RAPID_INDUCTION = "rapid_induction";
    public static final String COVERT_HYPNOSIS = "covert_hypnosis";
    public static final String NLP_MANIPULATION = "nlp_manipulation";
    
    private static final Map<String, ThreatPattern> PATTERNS = buildPatterns();
    
    private ThreatPatternCatalog() {
    }
    
    private static Map<String, ThreatPattern> buildPatterns() {
        Map<String, ThreatPattern> patterns = new LinkedHashMap<>();
        
        register(patterns, ThreatPattern.builder()
            .categoryId(EMBEDDED_COMMANDS)
            .indicator(Indicator.TONAL_SHIFT)
            .indicator(Indicator.PAUSE_PATTERN)
            .indicator(Indicator.ANALOG_MARKING)
            .keywords(List.of("now", "feel", "imagine", "notice", "realize"))
            .description("""
                Scanning for embedded commands...
                - Tonal shifts detected
                - Pause patterns identified
                - Command structure recognized""")
            .build());
        
        register(patterns, ThreatPattern.builder()
            .categoryId(CONFUSION_TECHNIQUE)
            .indicator(Indicator.MULTIPLE_NEGATIONS)
            .indicator(Indicator.PARADOX)
            .indicator(Indicator.OVERLOAD)
            .keywords(List.of("but", "yet", "however", "although", "unless"))
            .description("""
                Confusion pattern detected...
                - Logic loops identified
                - Paradoxical statements found
                - Cognitive overload attempted""")
            .build());
        
        register(patterns, ThreatPattern.builder()
            .categoryId(RAPID_INDUCTION)
            .indicator(Indicator.PATTERN_INTERRUPT)
            .indicator(Indicator.SHOCK)
            .indicator(Indicator.SUDDEN_COMMAND)
            .keywords(List.of("sleep", "now", "drop", "fall", "deep"))
            .description("""
                Rapid induction attempted...
                - Pattern interrupt detected
                - Shock element present
                - Command structure identified""")
            .build());
        
        register(patterns, ThreatPattern.builder()
            .categoryId(COVERT_HYPNOSIS)
            .indicator(Indicator.STORYTELLING)
            .indicator(Indicator.METAPHOR)
            .indicator(Indicator.INDIRECT_SUGGESTION)
            .keywords(List.of("like", "as if", "imagine if", "suppose", "what if"))
            .description("""
                Covert hypnosis detected...
                - Metaphorical language
                - Indirect suggestions
                - Story-based induction""")
            .build());
        
        register(patterns, ThreatPattern.builder()
            .categoryId(NLP_MANIPULATION)
            .indicator(Indicator.ANCHORING)
            .indicator(Indicator.REFRAMING)
            .indicator(Indicator.MIRRORING)
            .indicator(Indicator.PACING)
            .keywords(List.of("feel", "see", "hear", "understand", "know"))
            .description("""
                NLP patterns detected...
                - Sensory language
                - Pacing and leading
                - Anchoring attempts""")
            .build());
        
        return Collections.unmodifiableMap(patterns);
    }
    
    private static void register(Map<String, ThreatPattern> patterns, ThreatPattern pattern) {
        patterns.put(pattern.getCategoryId(), pattern);
    }
    
    /**
     * Все категории в порядке объявления
     */
    public static Collection<ThreatPattern> all() {
        return PATTERNS.values();
    }
    
    public static Optional<ThreatPattern> find(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PATTERNS.get(categoryId));
    }
    
    public static int size() {
        return PATTERNS.size();
    }
}
