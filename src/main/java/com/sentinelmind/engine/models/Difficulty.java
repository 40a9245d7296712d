package com.sentinelmind.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Slf4j
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    EXPERT("expert");
    
    private final String value;
    
    Difficulty(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static Difficulty fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return EASY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.value.equals(normalized)) {
                return difficulty;
            }
        }
        log.warn("Неизвестная сложность '{}', используется easy", raw);
        return EASY;
    }
}
