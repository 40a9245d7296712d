package com.sentinelmind.engine.cli;

import com.sentinelmind.engine.config.DefenseConfig;
import com.sentinelmind.engine.core.DefenseEngine;
import com.sentinelmind.engine.models.AgentProfile;
import com.sentinelmind.engine.models.AgentResponse;
import com.sentinelmind.engine.models.DefenseAnalysis;
import com.sentinelmind.engine.models.ThreatLevel;
import com.sentinelmind.engine.reports.JsonReportGenerator;
import com.sentinelmind.engine.web.DefenseWebApplication;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда ядра защиты
 */
@Slf4j
@Command(
    name = "sentinelmind",
    mixinStandardHelpOptions = true,
    version = "SentinelMind Defense Core 1.0.0",
    description = """
        
        SentinelMind Defense Core
        
        Обнаружение манипулятивных речевых паттернов и тренировочные агенты
        
        Возможности:
          • Оценка угрозы и выбор защитной стратегии
          • Протокол экстренного выхода
          • Адаптивные тренировочные агенты
          • REST интерфейс
        
        """,
    subcommands = {
        MainCommand.AnalyzeCommand.class,
        MainCommand.EmergencyCommand.class,
        MainCommand.PracticeCommand.class,
        MainCommand.WebCommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    
    @Spec
    CommandSpec spec;
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }
    
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
    
    /**
     * Анализ текста
     */
    @Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Проанализировать текст на манипулятивные паттерны")
    static class AnalyzeCommand implements Callable<Integer> {
        
        @Spec
        CommandSpec spec;
        
        @Parameters(arity = "1..*", description = "Анализируемый текст")
        List<String> words = new ArrayList<>();
        
        @Option(names = {"-m", "--mode"}, description = "Режим: aggressive, passive, auto (по умолчанию: auto)")
        String mode = "auto";
        
        @Option(names = {"-o", "--output"}, description = "Сохранить JSON отчет в файл")
        Path output;
        
        @Option(names = {"--fail-on"},
            description = "Код выхода 1, если уровень угрозы не ниже указанного (low, medium, high, critical)")
        String failOn;
        
        @Override
        public Integer call() throws Exception {
            ThreatLevel threshold = failOn != null ? parseLevel(failOn) : null;
            DefenseEngine engine = new DefenseEngine(DefenseConfig.load());
            DefenseAnalysis analysis = engine.analyzeThreat(String.join(" ", words), mode);
            
            JsonReportGenerator generator = new JsonReportGenerator();
            PrintWriter out = spec.commandLine().getOut();
            out.println(generator.render(analysis));
            out.flush();
            if (output != null) {
                generator.generate(analysis, output);
            }
            
            if (threshold != null && analysis.isThreatDetected()
                    && analysis.getThreatLevel().isAtLeast(threshold)) {
                log.warn("Уровень угрозы {} ({}) не ниже порога {} ({})",
                    analysis.getThreatLevel().getRussianName(), analysis.getThreatLevel().getValue(),
                    threshold.getRussianName(), threshold.getValue());
                return 1;
            }
            return 0;
        }
        
        private ThreatLevel parseLevel(String raw) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (ThreatLevel level : ThreatLevel.values()) {
                if (level != ThreatLevel.NONE && level.getValue().equals(normalized)) {
                    return level;
                }
            }
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Неизвестный уровень угрозы: " + raw + " (допустимо: low, medium, high, critical)");
        }
    }
    
    /**
     * "They got me"
     */
    @Command(name = "emergency", mixinStandardHelpOptions = true,
        description = "Активировать протокол экстренного выхода")
    static class EmergencyCommand implements Callable<Integer> {
        
        @Spec
        CommandSpec spec;
        
        @Override
        public Integer call() {
            DefenseEngine engine = new DefenseEngine(DefenseConfig.load());
            PrintWriter out = spec.commandLine().getOut();
            out.println(new JsonReportGenerator().render(engine.activateEmergencyProtocol()));
            out.flush();
            return 0;
        }
    }
    
    /**
     * Тренировка на агенте: несколько применений одной техники подряд
     */
    @Command(name = "practice", mixinStandardHelpOptions = true,
        description = "Создать тренировочного агента и применить к нему технику")
    static class PracticeCommand implements Callable<Integer> {
        
        @Spec
        CommandSpec spec;
        
        @Option(names = {"-a", "--archetype"}, description = "susceptible, resistant, adversarial")
        String archetype = "susceptible";
        
        @Option(names = {"-d", "--difficulty"}, description = "easy, medium, hard, expert")
        String difficulty = "easy";
        
        @Option(names = {"-t", "--technique"}, required = true, description = "Идентификатор техники")
        String technique;
        
        @Option(names = {"-c", "--content"}, description = "Текст, сопровождающий технику")
        String content = "";
        
        @Option(names = {"-r", "--rounds"}, description = "Количество применений (по умолчанию: 1)")
        int rounds = 1;
        
        @Option(names = {"--seed"}, description = "Seed генератора реакций")
        Long seed;
        
        @Option(names = {"--no-adaptive"}, description = "Отключить адаптивное обучение агента")
        boolean noAdaptive;
        
        @Override
        public Integer call() {
            if (rounds < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--rounds должен быть >= 1");
            }
            DefenseConfig config = DefenseConfig.load();
            DefenseEngine engine = seed != null
                ? new DefenseEngine(config, new Random(seed), Clock.systemDefaultZone())
                : new DefenseEngine(config);
            
            AgentProfile agent = engine.createAgent(archetype, difficulty, !noAdaptive);
            List<AgentResponse> responses = new ArrayList<>();
            for (int i = 0; i < rounds; i++) {
                responses.add(engine.respondToTechnique(agent.getId(), technique, content));
            }
            
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("agent", engine.getAgent(agent.getId()));
            report.put("responses", responses);
            report.put("learning", engine.getLearningProfile(agent.getId()));
            
            PrintWriter out = spec.commandLine().getOut();
            out.println(new JsonReportGenerator().render(report));
            out.flush();
            return 0;
        }
    }
    
    @Command(name = "web", mixinStandardHelpOptions = true,
        description = "Запустить REST интерфейс")
    static class WebCommand implements Callable<Integer> {
        
        @Option(names = {"--port"}, description = "Порт (по умолчанию: 8080)")
        int port = 8080;
        
        @Override
        public Integer call() {
            log.info("Запуск веб-интерфейса на порту {}...", port);
            DefenseWebApplication.main(new String[]{"--server.port=" + port});
            return 0;
        }
    }
}
