package com.sentinelmind.engine.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Счетчик применений техники и суммарная эффективность
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TechniqueStats {
    private int count;
    private double totalEffectiveness;
    
    public void record(double effectiveness) {
        count++;
        totalEffectiveness += effectiveness;
    }
    
    public double getAverageEffectiveness() {
        return count > 0 ? totalEffectiveness / count : 0.0;
    }
    
    public TechniqueStats copy() {
        return new TechniqueStats(count, totalEffectiveness);
    }
}
