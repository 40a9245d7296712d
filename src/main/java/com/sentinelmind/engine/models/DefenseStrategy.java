package com.sentinelmind.engine.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Шаблон контрмер. effectiveness (0-100) носит справочный характер.
 */
@Value
@Builder
public class DefenseStrategy {
    String id;
    String name;
    String description;
    @Singular("action")
    List<String> execution;
    int effectiveness;
}
