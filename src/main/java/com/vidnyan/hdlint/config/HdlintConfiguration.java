package com.vidnyan.hdlint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.hdlint.domain.rule.RuleChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for hdlint components.
 */
@Slf4j
@Configuration
public class HdlintConfiguration {

    /**
     * ObjectMapper for design files, rule definitions and reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available checkers on startup.
     */
    @Bean
    public String logCheckers(List<RuleChecker> checkers) {
        log.info("Registered {} rule checkers:", checkers.size());
        checkers.forEach(c -> log.info("  - {}", c.getName()));
        return "checkers-logged";
    }
}
