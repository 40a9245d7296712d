package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GroundingResponse {
    String affirmation;
    List<String> anchorPoints;
    List<String> realityChecks;
    String breathingPattern;
    List<String> physicalActions;
}
