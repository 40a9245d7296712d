package com.sentinelmind.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Архетип тренировочного агента
 */
@Slf4j
public enum AgentArchetype {
    SUSCEPTIBLE("susceptible"),
    RESISTANT("resistant"),
    ADVERSARIAL("adversarial");
    
    private final String value;
    
    AgentArchetype(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * "offensive" принимается как синоним adversarial.
     * Неизвестное значение -> SUSCEPTIBLE.
     */
    @JsonCreator
    public static AgentArchetype fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUSCEPTIBLE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("offensive".equals(normalized)) {
            return ADVERSARIAL;
        }
        for (AgentArchetype archetype : values()) {
            if (archetype.value.equals(normalized)) {
                return archetype;
            }
        }
        log.warn("Неизвестный архетип агента '{}', используется susceptible", raw);
        return SUSCEPTIBLE;
    }
}
