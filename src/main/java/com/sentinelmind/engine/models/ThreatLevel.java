package com.sentinelmind.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Уровни угрозы (порядковые: NONE < LOW < MEDIUM < HIGH < CRITICAL)
 */
public enum ThreatLevel {
    NONE("none", "Нет угрозы"),
    LOW("low", "Низкий"),
    MEDIUM("medium", "Средний"),
    HIGH("high", "Высокий"),
    CRITICAL("critical", "Критический");
    
    private final String value;
    private final String russianName;
    
    ThreatLevel(String value, String russianName) {
        this.value = value;
        this.russianName = russianName;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public boolean isAtLeast(ThreatLevel other) {
        return compareTo(other) >= 0;
    }
}
