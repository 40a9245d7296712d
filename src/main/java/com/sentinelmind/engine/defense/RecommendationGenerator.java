package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.models.DetectedThreat;
import com.sentinelmind.engine.models.ThreatLevel;

import java.util.ArrayList;
import java.util.List;

public class RecommendationGenerator {
    
    private static final List<String> CRITICAL_DIRECTIVES = List.of(
        "⚠️ IMMEDIATE ACTION: Physically remove yourself from situation",
        "🛡️ Activate full shield protocol",
        "📱 Call trusted friend for reality check");
    
    private static final List<String> HIGH_DIRECTIVES = List.of(
        "🔍 Maintain heightened awareness",
        "💪 Use pattern interrupt techniques",
        "🎯 Focus on physical sensations");
    
    private static final List<String> FOLLOW_UP_DIRECTIVES = List.of(
        "📊 Document this interaction for analysis",
        "🧠 Practice defensive techniques regularly",
        "👥 Share experience with support network");
    
    private RecommendationGenerator() {
    }
    
    public static List<String> recommend(ThreatLevel level, List<DetectedThreat> threats) {
        List<String> recommendations = new ArrayList<>();
        
        if (level == ThreatLevel.CRITICAL) {
            recommendations.addAll(CRITICAL_DIRECTIVES);
        }
        
        if (level == ThreatLevel.HIGH) {
            recommendations.addAll(HIGH_DIRECTIVES);
        }
        
        if (threats != null && !threats.isEmpty()) {
            recommendations.addAll(FOLLOW_UP_DIRECTIVES);
        }
        
        return recommendations;
    }
}
