package com.sentinelmind.engine.core;

import lombok.Getter;

/**
 * Операция ссылается на несуществующего агента
 */
@Getter
public class AgentNotFoundException extends DefenseException {
    
    private final String agentId;
    
    public AgentNotFoundException(String agentId) {
        super("Агент не найден: " + agentId);
        this.agentId = agentId;
    }
}
