package com.sentinelmind.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Режим выбора защитной стратегии
 */
@Slf4j
public enum DefenseMode {
    AGGRESSIVE("aggressive"),
    PASSIVE("passive"),
    AUTO("auto");
    
    private final String value;
    
    DefenseMode(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Разбор режима. Неизвестное или пустое значение -> AUTO (без исключения).
     */
    @JsonCreator
    public static DefenseMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DefenseMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        log.warn("Неизвестный режим защиты '{}', используется auto", raw);
        return AUTO;
    }
}
