package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Запись истории взаимодействий агента
 */
@Value
@Builder
public class InteractionRecord {
    Instant timestamp;
    String technique;
    double effectiveness;
    String response;
}
