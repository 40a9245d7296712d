package com.sentinelmind.engine.agents;

import java.util.List;

/**
 * Уровни реакции агента и их наборы готовых фраз
 */
public enum ResponseTier {
    HIGH(
        List.of(
            "Mmm... yes... feeling so relaxed...",
            "Going deeper... can't resist...",
            "So heavy... so comfortable...",
            "Yes... whatever you say..."),
        List.of(
            "Eyes closing, body relaxing, breathing slowing",
            "Head dropping forward, shoulders loose"),
        List.of(
            "Reduced critical thinking, increased suggestibility",
            "Critical factor bypassed, absorbed in suggestion")),
    
    MEDIUM(
        List.of(
            "I feel... different... but still here...",
            "That's... interesting... I can feel something...",
            "Part of me wants to let go...",
            "I'm relaxed but... still aware..."),
        List.of(
            "Some relaxation, occasional eye flutter",
            "Breathing slower, posture still upright"),
        List.of(
            "Partial focus, some analytical thought remaining",
            "Drifting between absorption and evaluation")),
    
    LOW(
        List.of(
            "I see what you're trying to do.",
            "That technique won't work on me.",
            "Nice try, but I'm fully aware.",
            "I'm consciously resisting that suggestion."),
        List.of(
            "Alert, possibly tensing",
            "Eyes open and tracking, arms crossed"),
        List.of(
            "Fully analytical, detecting techniques",
            "Actively labelling the technique being used"));
    
    private static final double HIGH_THRESHOLD = 70;
    private static final double MEDIUM_THRESHOLD = 40;
    
    private final List<String> verbal;
    private final List<String> physical;
    private final List<String> cognitive;
    
    ResponseTier(List<String> verbal, List<String> physical, List<String> cognitive) {
        this.verbal = verbal;
        this.physical = physical;
        this.cognitive = cognitive;
    }
    
    public static ResponseTier forEffectiveness(double effectiveness) {
        if (effectiveness > HIGH_THRESHOLD) {
            return HIGH;
        }
        if (effectiveness > MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
    
    public List<String> getVerbal() {
        return verbal;
    }
    
    public List<String> getPhysical() {
        return physical;
    }
    
    public List<String> getCognitive() {
        return cognitive;
    }
}
