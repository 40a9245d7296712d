package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Изменяемое состояние агента. Все числовые поля всегда в [0, 100]:
 * сеттеры зажимают значение в диапазон.
 */
@Getter
public class AgentState {
    
    private double tranceDepth;
    private double resistance;
    private double suggestibility;
    private double awareness;
    
    @Setter
    private String emotional;
    
    private final List<InteractionRecord> history = new ArrayList<>();
    
    @Builder
    private AgentState(double tranceDepth, double resistance, double suggestibility,
                       double awareness, String emotional) {
        setTranceDepth(tranceDepth);
        setResistance(resistance);
        setSuggestibility(suggestibility);
        setAwareness(awareness);
        this.emotional = emotional;
    }
    
    public void setTranceDepth(double tranceDepth) {
        this.tranceDepth = clamp(tranceDepth);
    }
    
    public void setResistance(double resistance) {
        this.resistance = clamp(resistance);
    }
    
    public void setSuggestibility(double suggestibility) {
        this.suggestibility = clamp(suggestibility);
    }
    
    public void setAwareness(double awareness) {
        this.awareness = clamp(awareness);
    }
    
    /**
     * История только дополняется
     */
    public void appendHistory(InteractionRecord record) {
        history.add(record);
    }
    
    public List<InteractionRecord> getHistory() {
        return Collections.unmodifiableList(history);
    }
    
    /**
     * Отсоединенная копия: числовые поля, эмоция и история на момент вызова
     */
    public AgentState snapshot() {
        AgentState copy = new AgentState(tranceDepth, resistance, suggestibility, awareness, emotional);
        copy.history.addAll(history);
        return copy;
    }
    
    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(100, value));
    }
}
