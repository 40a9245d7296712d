package com.sentinelmind.engine.web;

import com.sentinelmind.engine.core.DefenseEngine;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * REST-оболочка над ядром
 *
 * Запуск:
 * java -jar sentinelmind-defense-core.jar web --port 8080
 */
@SpringBootApplication
public class DefenseWebApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(DefenseWebApplication.class, args);
    }
    
    @Bean
    public DefenseEngine defenseEngine() {
        return new DefenseEngine();
    }
}
