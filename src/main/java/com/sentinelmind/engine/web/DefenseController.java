package com.sentinelmind.engine.web;

import com.sentinelmind.engine.core.AgentNotFoundException;
import com.sentinelmind.engine.core.DefenseEngine;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.DefenseAnalysis;
import com.sentinelmind.engine.models.EmergencyProtocol;
import com.sentinelmind.engine.models.TechniqueOutcome;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API контроллер ядра защиты.
 * Хранение сессий, аутентификация и лимиты - ответственность внешнего слоя.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class DefenseController {
    
    private final DefenseEngine engine;
    
    public DefenseController(DefenseEngine engine) {
        this.engine = engine;
    }
    
    /**
     * POST /api/v1/defense/analyze
     * {"input": "...", "mode": "aggressive|passive|auto"}
     */
    @PostMapping("/defense/analyze")
    public ResponseEntity<Map<String, Object>> analyze(@RequestBody AnalyzeRequest request) {
        DefenseAnalysis analysis = engine.analyzeThreat(request.getInput(), request.getMode());
        return ok("analysis", analysis);
    }
    
    /**
     * POST /api/v1/defense/emergency-protocol
     */
    @PostMapping("/defense/emergency-protocol")
    public ResponseEntity<Map<String, Object>> emergencyProtocol() {
        EmergencyProtocol protocol = engine.activateEmergencyProtocol();
        Map<String, Object> body = envelope();
        body.put("message", "Full protocol initiated. You're safe now.");
        body.put("protocol", protocol);
        return ResponseEntity.ok(body);
    }
    
    @GetMapping("/defense/grounding")
    public ResponseEntity<Map<String, Object>> grounding() {
        return ok("grounding", engine.groundingProtocol());
    }
    
    @GetMapping("/defense/patterns")
    public ResponseEntity<Map<String, Object>> patterns() {
        Map<String, Object> body = envelope();
        body.put("patterns", engine.listThreatPatterns());
        body.put("strategies", engine.listDefenseStrategies());
        return ResponseEntity.ok(body);
    }
    
    /**
     * POST /api/v1/practice/agents
     * {"archetype": "resistant", "difficulty": "hard", "adaptiveLearning": true}
     */
    @PostMapping("/practice/agents")
    public ResponseEntity<Map<String, Object>> createAgent(@RequestBody CreateAgentRequest request) {
        AgentProfile agent = engine.createAgent(
            request.getArchetype(), request.getDifficulty(), request.isAdaptiveLearning());
        return ok("agent", agent);
    }
    
    @GetMapping("/practice/agents/{agentId}")
    public ResponseEntity<Map<String, Object>> getAgent(@PathVariable String agentId) {
        return ok("agent", engine.getAgent(agentId));
    }
    
    /**
     * POST /api/v1/practice/agents/{agentId}/respond
     * {"technique": "rapid_induction", "content": "..."}
     */
    @PostMapping("/practice/agents/{agentId}/respond")
    public ResponseEntity<Map<String, Object>> respond(@PathVariable String agentId,
                                                       @RequestBody TechniqueRequest request) {
        TechniqueOutcome outcome = engine.applyTechnique(agentId, request.getTechnique(), request.getContent());
        Map<String, Object> body = envelope();
        body.put("response", outcome.getResponse());
        body.put("state", outcome.getState());
        return ResponseEntity.ok(body);
    }
    
    /**
     * POST /api/v1/practice/agents/{agentId}/learning
     * {"technique": "rapid_induction", "effectiveness": 85}
     */
    @PostMapping("/practice/agents/{agentId}/learning")
    public ResponseEntity<Map<String, Object>> recordLearning(@PathVariable String agentId,
                                                              @RequestBody LearningRequest request) {
        boolean adapted = engine.recordLearning(agentId, request.getTechnique(), request.getEffectiveness());
        Map<String, Object> body = envelope();
        body.put("adapted", adapted);
        body.put("learning", engine.getLearningProfile(agentId));
        return ResponseEntity.ok(body);
    }
    
    @GetMapping("/practice/agents/{agentId}/learning")
    public ResponseEntity<Map<String, Object>> learning(@PathVariable String agentId) {
        return ok("learning", engine.getLearningProfile(agentId));
    }
    
    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AgentNotFoundException e) {
        log.warn("Запрос к несуществующему агенту: {}", e.getAgentId());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.error("Ошибка валидации: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Внутренняя ошибка: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Внутренняя ошибка сервера: " + e.getMessage());
    }
    
    private static Map<String, Object> envelope() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }
    
    private static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> body = envelope();
        body.put(key, value);
        return ResponseEntity.ok(body);
    }
    
    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
    
    @Data
    public static class AnalyzeRequest {
        private String input;
        private String mode;
    }
    
    @Data
    public static class CreateAgentRequest {
        private String archetype;
        private String difficulty;
        private boolean adaptiveLearning = true;
    }
    
    @Data
    public static class TechniqueRequest {
        private String technique;
        private String content;
    }
    
    @Data
    public static class LearningRequest {
        private String technique;
        private double effectiveness;
    }
}
