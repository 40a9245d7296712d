package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Протокол экстренного выхода ("They got me")
 */
@Value
@Builder
public class EmergencyProtocol {
    String status;
    List<String> extractionSteps;
    GroundingResponse groundingSequence;
    boolean shieldActivated;
    boolean counterAttackReady;
    String safeWord;
}
