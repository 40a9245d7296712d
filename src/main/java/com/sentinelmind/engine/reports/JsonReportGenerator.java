package com.sentinelmind.engine.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON (анализ, протокол, профиль агента, реакция)
 */
@Slf4j
public class JsonReportGenerator {
    
    private final ObjectMapper objectMapper;
    
    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    public String render(Object result) {
        if (result == null) {
            throw new IllegalArgumentException("Результат не может быть null");
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Не удалось сериализовать результат", e);
        }
    }
    
    public void generate(Object result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        
        String json = render(result);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, json);
        
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }
    
    public String getFileExtension() {
        return "json";
    }
}
