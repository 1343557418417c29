package com.vidnyan.hdlint.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.hdlint.application.port.out.RuleRepository;
import com.vidnyan.hdlint.domain.rule.BuiltInRules;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system based rule repository.
 * Loads rule definitions from JSON files; a built-in rule without a file keeps its defaults.
 */
@Slf4j
@Component
public class FileSystemRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;
    private final String rulesPath;

    private final Map<String, RuleDefinition> rules = new ConcurrentHashMap<>();

    public FileSystemRuleRepository(ObjectMapper objectMapper,
                                    @Value("${hdlint.rules.path:classpath*:rules/*.json}") String rulesPath) {
        this.objectMapper = objectMapper;
        this.rulesPath = rulesPath;
    }

    @PostConstruct
    public void loadRules() {
        rules.clear();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(rulesPath);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    RuleDto dto = objectMapper.readValue(in, RuleDto.class);
                    RuleDefinition rule = mapToRule(dto);
                    rules.put(rule.id(), rule);
                    log.info("Loaded rule: {} - {} ({})", rule.id(), rule.name(), rule.severity());
                } catch (Exception e) {
                    log.warn("Failed to load rule from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} rules from {}", rules.size(), rulesPath);
        } catch (IOException e) {
            log.error("Failed to load rules from {}", rulesPath, e);
        }

        for (RuleDefinition builtIn : BuiltInRules.all()) {
            if (rules.putIfAbsent(builtIn.id(), builtIn) == null) {
                log.debug("Using built-in definition for {}", builtIn.id());
            }
        }
    }

    @Override
    public Optional<RuleDefinition> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<RuleDefinition> findEnabled() {
        return sorted(rules.values().stream()
                .filter(RuleDefinition::isEnabled)
                .toList());
    }

    private static List<RuleDefinition> sorted(Collection<RuleDefinition> definitions) {
        return definitions.stream()
                .sorted(Comparator.comparing(RuleDefinition::id))
                .toList();
    }

    /**
     * Unset fields of a built-in rule fall back to its defaults.
     */
    private RuleDefinition mapToRule(RuleDto dto) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new IllegalArgumentException("rule definition without id");
        }
        Optional<RuleDefinition> defaults = BuiltInRules.find(dto.id);
        return RuleDefinition.builder()
                .id(dto.id)
                .name(dto.name != null ? dto.name : defaults.map(RuleDefinition::name).orElse(dto.id))
                .description(dto.description != null ? dto.description
                        : defaults.map(RuleDefinition::description).orElse(null))
                .severity(dto.severity != null ? mapSeverity(dto.severity)
                        : defaults.map(RuleDefinition::severity).orElse(RuleDefinition.Severity.ERROR))
                .category(dto.category != null ? mapCategory(dto.category)
                        : defaults.map(RuleDefinition::category).orElse(RuleDefinition.Category.CUSTOM))
                .remediation(mapRemediation(dto.remediation))
                .isEnabled(dto.isEnabled != null ? dto.isEnabled : true)
                .build();
    }

    private RuleDefinition.Severity mapSeverity(String severity) {
        return switch (severity.toUpperCase(Locale.ROOT)) {
            case "BLOCKER" -> RuleDefinition.Severity.BLOCKER;
            case "WARN", "WARNING" -> RuleDefinition.Severity.WARN;
            case "INFO" -> RuleDefinition.Severity.INFO;
            default -> RuleDefinition.Severity.ERROR;
        };
    }

    private RuleDefinition.Category mapCategory(String category) {
        return switch (category.toUpperCase(Locale.ROOT).replace("-", "_").replace(" ", "_")) {
            case "SENSITIVITY" -> RuleDefinition.Category.SENSITIVITY;
            case "LATCH_INFERENCE" -> RuleDefinition.Category.LATCH_INFERENCE;
            case "REGISTER_DISCIPLINE" -> RuleDefinition.Category.REGISTER_DISCIPLINE;
            default -> RuleDefinition.Category.CUSTOM;
        };
    }

    private RuleDefinition.Remediation mapRemediation(RemediationDto dto) {
        if (dto == null) return null;
        return new RuleDefinition.Remediation(
                dto.quickFix,
                dto.explanation,
                dto.references != null ? dto.references : List.of()
        );
    }

    // DTO classes for JSON deserialization
    static class RuleDto {
        public String id;
        public String name;
        public String description;
        public String severity;
        public String category;
        public RemediationDto remediation;
        public Boolean isEnabled;
    }

    static class RemediationDto {
        public String quickFix;
        public String explanation;
        public List<String> references;
    }
}
