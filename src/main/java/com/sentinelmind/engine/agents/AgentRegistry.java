package com.sentinelmind.engine.agents;

import com.sentinelmind.engine.core.AgentNotFoundException;
import com.sentinelmind.engine.models.AgentProfile;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Реестр живых агентов с блокировкой на каждого агента.
 * Вызовы для одного id выполняются последовательно, для разных id - независимо.
 * Блокировка реентерабельная: трекер обучения может брать ее внутри respond.
 */
public class AgentRegistry {
    
    private final Map<String, Entry> agents = new ConcurrentHashMap<>();
    
    public void register(AgentProfile profile) {
        agents.put(profile.getId(), new Entry(profile));
    }
    
    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }
    
    public int size() {
        return agents.size();
    }
    
    /**
     * Выполнить действие, удерживая блокировку агента
     * @throws AgentNotFoundException если агента нет
     */
    public <T> T withExclusive(String agentId, Function<AgentProfile, T> action) {
        Entry entry = entry(agentId);
        entry.lock.lock();
        try {
            return action.apply(entry.profile);
        } finally {
            entry.lock.unlock();
        }
    }
    
    private Entry entry(String agentId) {
        Entry entry = agentId != null ? agents.get(agentId) : null;
        if (entry == null) {
            throw new AgentNotFoundException(agentId);
        }
        return entry;
    }
    
    private static final class Entry {
        private final AgentProfile profile;
        private final ReentrantLock lock = new ReentrantLock();
        
        private Entry(AgentProfile profile) {
            this.profile = profile;
        }
    }
}
