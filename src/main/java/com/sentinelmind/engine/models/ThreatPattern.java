package com.sentinelmind.engine.models;

import com.sentinelmind.engine.knowledge.Indicator;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Категория атаки: ключ, индикаторы, ключевые слова, шаблон описания.
 * Неизменяемая, создается один раз в каталоге.
 */
@Value
@Builder
public class ThreatPattern {
    String categoryId;
    @Singular
    List<Indicator> indicators;
    @Singular
    List<String> keywords;
    String description;
}
