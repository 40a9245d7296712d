package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

/**
 * Реакция агента и снимок его состояния сразу после этой реакции
 */
@Value
@Builder
public class TechniqueOutcome {
    AgentResponse response;
    AgentState state;
}
