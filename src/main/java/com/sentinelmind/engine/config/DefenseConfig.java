package com.sentinelmind.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sentinelmind.engine.core.DefenseException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация ядра из YAML файла.
 * Отсутствующие секции и значения заменяются значениями по умолчанию.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DefenseConfig {
    
    public static final String DEFAULT_RESOURCE = "defense-config.yaml";
    
    private Detection detection;
    private Learning learning;
    private Simulation simulation;
    private Emergency emergency;
    
    private static volatile DefenseConfig instance;
    
    /**
     * Загрузить конфигурацию по умолчанию из classpath (кешируется)
     */
    public static DefenseConfig load() {
        DefenseConfig local = instance;
        if (local == null) {
            synchronized (DefenseConfig.class) {
                local = instance;
                if (local == null) {
                    local = load(DEFAULT_RESOURCE);
                    instance = local;
                }
            }
        }
        return local;
    }
    
    /**
     * Загрузить конфигурацию из указанного ресурса classpath (без кеширования)
     */
    public static DefenseConfig load(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = DefenseConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new DefenseException(resource + " не найден в classpath");
            }
            DefenseConfig config = mapper.readValue(is, DefenseConfig.class);
            if (config == null) {
                config = new DefenseConfig();
            }
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}", resource);
            return config;
        } catch (IOException e) {
            throw new DefenseException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }
    
    /**
     * Значения по умолчанию без обращения к classpath
     */
    public static DefenseConfig defaults() {
        DefenseConfig config = new DefenseConfig();
        config.ensureDefaults();
        return config;
    }
    
    private void ensureDefaults() {
        if (detection == null) {
            detection = new Detection();
        }
        detection.ensureDefaults();
        if (learning == null) {
            learning = new Learning();
        }
        learning.ensureDefaults();
        if (simulation == null) {
            simulation = new Simulation();
        }
        if (emergency == null) {
            emergency = new Emergency();
        }
        emergency.ensureDefaults();
    }
    
    @Data
    public static class Detection {
        private static final int DEFAULT_KEYWORD_WEIGHT = 10;
        private static final int DEFAULT_INDICATOR_WEIGHT = 20;
        private static final int DEFAULT_DETECTION_THRESHOLD = 30;
        
        private Integer keywordWeight;
        private Integer indicatorWeight;
        private Integer detectionThreshold; // категория засчитывается при score > threshold
        
        private void ensureDefaults() {
            if (keywordWeight == null || keywordWeight < 0) {
                keywordWeight = DEFAULT_KEYWORD_WEIGHT;
            }
            if (indicatorWeight == null || indicatorWeight < 0) {
                indicatorWeight = DEFAULT_INDICATOR_WEIGHT;
            }
            if (detectionThreshold == null || detectionThreshold < 0) {
                detectionThreshold = DEFAULT_DETECTION_THRESHOLD;
            }
        }
    }
    
    @Data
    public static class Learning {
        private static final int DEFAULT_ADAPTATION_INTERVAL = 5;
        private static final double DEFAULT_EFFECTIVE_THRESHOLD = 70.0;
        private static final double DEFAULT_RESISTANCE_STEP = 5.0;
        private static final double DEFAULT_RESISTANCE_CAP = 95.0;
        
        private Integer adaptationInterval;
        private Double effectiveTechniqueThreshold;
        private Double resistanceStep;
        private Double resistanceCap;
        
        private void ensureDefaults() {
            if (adaptationInterval == null || adaptationInterval <= 0) {
                adaptationInterval = DEFAULT_ADAPTATION_INTERVAL;
            }
            if (effectiveTechniqueThreshold == null) {
                effectiveTechniqueThreshold = DEFAULT_EFFECTIVE_THRESHOLD;
            }
            if (resistanceStep == null || resistanceStep < 0) {
                resistanceStep = DEFAULT_RESISTANCE_STEP;
            }
            if (resistanceCap == null || resistanceCap < 0 || resistanceCap > 100) {
                resistanceCap = DEFAULT_RESISTANCE_CAP;
            }
        }
    }
    
    @Data
    public static class Simulation {
        private Long randomSeed; // null -> несидированный источник
    }
    
    @Data
    public static class Emergency {
        private static final String DEFAULT_DATE_PATTERN = "M/d/yyyy";
        
        private String realityCheckDatePattern;
        
        private void ensureDefaults() {
            if (realityCheckDatePattern == null || realityCheckDatePattern.isBlank()) {
                realityCheckDatePattern = DEFAULT_DATE_PATTERN;
            }
        }
    }
}
