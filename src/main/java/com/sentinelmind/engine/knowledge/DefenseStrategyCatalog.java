package com.sentinelmind.engine.knowledge;

import com.sentinelmind.engine.models.DefenseStrategy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Каталог защитных стратегий
 */
public final class DefenseStrategyCatalog {
    
    public static final String PATTERN_INTERRUPT = "pattern_interrupt";
    public static final String CONSCIOUS_ANALYSIS = "conscious_analysis";
    public static final String REALITY_ANCHOR = "reality_anchor";
    public static final String COUNTER_SUGGESTION = "counter_suggestion";
    public static final String SHIELD_PROTOCOL = "shield_protocol";
    
    private static final Map<String, DefenseStrategy> STRATEGIES = buildStrategies();
    
    private DefenseStrategyCatalog() {
    }
    
    private static Map<String, DefenseStrategy> buildStrategies() {
        Map<String, DefenseStrategy> strategies = new LinkedHashMap<>();
        
        register(strategies, DefenseStrategy.builder()
            .id(PATTERN_INTERRUPT)
            .name("Pattern Interrupt")
            .description("Break the hypnotic pattern with unexpected response")
            .action("Suddenly change topic")
            .action("Ask unexpected question")
            .action("Physical movement")
            .action("Laugh or make joke")
            .effectiveness(85)
            .build());
        
        register(strategies, DefenseStrategy.builder()
            .id(CONSCIOUS_ANALYSIS)
            .name("Conscious Analysis")
            .description("Actively analyze and deconstruct the technique")
            .action("Identify technique being used")
            .action("Call out the pattern")
            .action("Explain what they're doing")
            .action("Maintain analytical mindset")
            .effectiveness(75)
            .build());
        
        register(strategies, DefenseStrategy.builder()
            .id(REALITY_ANCHOR)
            .name("Reality Anchor")
            .description("Ground yourself in physical reality")
            .action("Focus on physical sensations")
            .action("Count objects in room")
            .action("State current facts")
            .action("Touch physical anchor")
            .effectiveness(80)
            .build());
        
        register(strategies, DefenseStrategy.builder()
            .id(COUNTER_SUGGESTION)
            .name("Counter Suggestion")
            .description("Override with your own suggestions")
            .action("Create opposite suggestion")
            .action("Affirm your control")
            .action("Set your own mental state")
            .action("Reverse the suggestion")
            .effectiveness(70)
            .build());
        
        register(strategies, DefenseStrategy.builder()
            .id(SHIELD_PROTOCOL)
            .name("Mental Shield")
            .description("Visualize protective barrier")
            .action("Imagine protective shield")
            .action("Deflect suggestions")
            .action("Maintain boundaries")
            .action("Strengthen mental walls")
            .effectiveness(65)
            .build());
        
        return Collections.unmodifiableMap(strategies);
    }
    
    private static void register(Map<String, DefenseStrategy> strategies, DefenseStrategy strategy) {
        strategies.put(strategy.getId(), strategy);
    }
    
    public static Collection<DefenseStrategy> all() {
        return STRATEGIES.values();
    }
    
    public static Optional<DefenseStrategy> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(STRATEGIES.get(id));
    }
    
    /**
     * Стратегия, которая обязана присутствовать в каталоге
     */
    public static DefenseStrategy require(String id) {
        return find(id).orElseThrow(() ->
            new IllegalStateException("Стратегия отсутствует в каталоге: " + id));
    }
}
