package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Value;

/**
 * Результат оценки одной категории для одного входного текста
 */
@Value
@Builder
public class DetectedThreat {
    String type;
    String pattern;
    int score;
    double confidence;
}
