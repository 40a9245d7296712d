package com.sentinelmind.engine.knowledge;

import java.util.regex.Pattern;

/**
 * Структурные индикаторы манипулятивной речи.
 * Проверка выполняется по тексту в нижнем регистре.
 * Индикаторы без эвристики (pattern == null) распознаются в каталоге, но никогда не срабатывают.
 */
public enum Indicator {
    TONAL_SHIFT("tonal_shift", "[.!?]\\s*\\w+\\s*[.!?]"),
    PAUSE_PATTERN("pause_pattern", "\\.\\.\\."),
    ANALOG_MARKING("analog_marking", "\\*\\w+\\*"),
    MULTIPLE_NEGATIONS("multiple_negations", "(not|n't).*?(not|n't)"),
    PARADOX("paradox", "(but|yet|however).*?(but|yet|however)"),
    OVERLOAD("overload", null),
    PATTERN_INTERRUPT("pattern_interrupt", "suddenly|now|stop|wait"),
    SHOCK("shock", null),
    SUDDEN_COMMAND("sudden_command", null),
    STORYTELLING("storytelling", "once upon|imagine|let me tell"),
    METAPHOR("metaphor", "like|as if|just like"),
    INDIRECT_SUGGESTION("indirect_suggestion", null),
    ANCHORING("anchoring", "every time|whenever|each time"),
    REFRAMING("reframing", null),
    MIRRORING("mirroring", null),
    PACING("pacing", null);
    
    private final String id;
    private final Pattern pattern;
    
    Indicator(String id, String regex) {
        this.id = id;
        this.pattern = regex != null ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : null;
    }
    
    public String getId() {
        return id;
    }
    
    public boolean hasHeuristic() {
        return pattern != null;
    }
    
    /**
     * @param lowercaseInput текст, уже приведенный к нижнему регистру
     */
    public boolean matches(String lowercaseInput) {
        if (pattern == null || lowercaseInput == null) {
            return false;
        }
        return pattern.matcher(lowercaseInput).find();
    }
}
