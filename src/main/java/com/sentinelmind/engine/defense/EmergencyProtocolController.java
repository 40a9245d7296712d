package com.sentinelmind.engine.defense;

import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.models.EmergencyProtocol;
import com.sentinelmind.engine.models.GroundingResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Протокол экстренного выхода.
 * Каждый вызов activate() заново строит одну и ту же последовательность;
 * состояние между вызовами не хранится, единственное внешнее чтение - текущая дата.
 */
@Slf4j
public class EmergencyProtocolController {
    
    public static final String STATUS_ACTIVATED = "activated";
    public static final String SAFE_WORD = "BASELINE";
    
    static final List<String> EXTRACTION_STEPS = List.of(
        "1. STOP - Cease all current mental activity",
        "2. GROUND - Touch physical object, state your name",
        "3. ORIENT - State location, date, time",
        "4. REJECT - \"I reject all suggestions\"",
        "5. SHIELD - Visualize impenetrable barrier",
        "6. EXTRACT - Leave situation immediately",
        "7. RECOVER - Find safe space, contact support");
    
    private static final String AFFIRMATION =
        "I am in control. I choose my thoughts. I am safe and grounded.";
    
    private static final List<String> ANCHOR_POINTS = List.of(
        "Feel your feet on the ground",
        "Touch something solid",
        "Look at something blue",
        "Name 5 things you can see",
        "Name 4 things you can touch");
    
    private static final String BREATHING_PATTERN = "4-7-8 breathing: Inhale 4, Hold 7, Exhale 8";
    
    private static final List<String> PHYSICAL_ACTIONS = List.of(
        "Stand up and stretch",
        "Splash cold water on face",
        "Step outside for fresh air",
        "Call a trusted friend",
        "Write down your thoughts");
    
    private final Clock clock;
    private final DateTimeFormatter dateFormatter;
    
    public EmergencyProtocolController() {
        this(Clock.systemDefaultZone(), DefenseConfig.defaults().getEmergency());
    }
    
    public EmergencyProtocolController(Clock clock, DefenseConfig.Emergency settings) {
        this.clock = clock;
        this.dateFormatter = DateTimeFormatter.ofPattern(settings.getRealityCheckDatePattern(), Locale.US);
    }
    
    public EmergencyProtocol activate() {
        log.info("Активирован протокол экстренного выхода");
        
        return EmergencyProtocol.builder()
            .status(STATUS_ACTIVATED)
            .extractionSteps(EXTRACTION_STEPS)
            .groundingSequence(groundingProtocol())
            .shieldActivated(true)
            .counterAttackReady(true)
            .safeWord(SAFE_WORD)
            .build();
    }
    
    /**
     * Только набор заземления, без последовательности выхода
     */
    public GroundingResponse groundingProtocol() {
        String today = LocalDate.now(clock).format(dateFormatter);
        
        return GroundingResponse.builder()
            .affirmation(AFFIRMATION)
            .anchorPoints(ANCHOR_POINTS)
            .realityChecks(List.of(
                "Today is " + today,
                "You are safe",
                "You control your mind",
                "This will pass",
                "You have the power"))
            .breathingPattern(BREATHING_PATTERN)
            .physicalActions(PHYSICAL_ACTIONS)
            .build();
    }
}
