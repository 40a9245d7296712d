package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

/**
 * Реакция агента на примененную технику
 */
@Value
@Builder
public class AgentResponse {
    String technique;
    String verbal;
    String physical;
    String cognitive;
    double effectiveness;
}
