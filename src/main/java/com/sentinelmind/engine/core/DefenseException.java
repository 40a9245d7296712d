package com.sentinelmind.engine.core;

/**
 * Базовое исключение ядра защиты
 */
public class DefenseException extends RuntimeException {
    
    public DefenseException(String message) {
        super(message);
    }
    
    public DefenseException(String message, Throwable cause) {
        super(message, cause);
    }
}
