package com.vidnyan.hdlint.adapter.out.loader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.hdlint.application.port.out.DesignLoader;
import com.vidnyan.hdlint.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the JSON design description produced by the HDL front end.
 *
 * Structure is plain JSON; every expression is a string in source form and goes through
 * {@link ExpressionParser}. Concurrent and sequential statements are single-key objects
 * naming their kind, e.g. {@code {"process": {...}}} or {@code {"if": {...}}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonDesignLoader implements DesignLoader {

    private final ObjectMapper objectMapper;

    @Override
    public Design load(Path path) {
        log.info("Loading design description {}", path);
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new DesignLoadException("Cannot read design file " + path + ": " + e.getMessage(), e);
        }
        return parse(json, path.toString());
    }

    /**
     * Parse a design description held in memory.
     * @param sourceName file name used in locations when the description names none
     */
    public Design parse(String json, String sourceName) {
        DesignDto dto;
        try {
            dto = objectMapper.readValue(json, DesignDto.class);
        } catch (JsonProcessingException e) {
            throw new DesignLoadException("Malformed design description " + sourceName + ": "
                    + e.getOriginalMessage(), e);
        }
        String file = dto.file != null ? dto.file : sourceName;

        List<DesignUnit> units = new ArrayList<>();
        List<Architecture> architectures = new ArrayList<>();
        try {
            for (UnitDto unit : list(dto.units)) {
                units.add(mapUnit(unit, file));
            }
            for (ArchitectureDto architecture : list(dto.architectures)) {
                architectures.add(mapArchitecture(architecture, file));
            }
        } catch (IllegalArgumentException e) {
            throw new DesignLoadException("Invalid design description " + sourceName + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} units and {} architectures from {}", units.size(), architectures.size(), sourceName);
        return new Design(units, architectures);
    }

    private DesignUnit mapUnit(UnitDto dto, String defaultFile) {
        String name = required(dto.name, "unit name");
        String file = dto.file != null ? dto.file : defaultFile;
        List<Generic> generics = new ArrayList<>();
        for (GenericDto generic : list(dto.generics)) {
            generics.add(new Generic(required(generic.name, "generic name of unit " + name),
                    generic.type != null ? generic.type : "integer",
                    Optional.ofNullable(generic.defaultValue).map(ExpressionParser::parse)));
        }
        List<Port> ports = new ArrayList<>();
        for (PortDto port : list(dto.ports)) {
            ports.add(new Port(required(port.name, "port name of unit " + name),
                    direction(port.direction),
                    port.width != null ? ExpressionParser.parse(port.width) : null));
        }
        return new DesignUnit(name, generics, ports, location(file, dto.line, dto.column));
    }

    private Architecture mapArchitecture(ArchitectureDto dto, String defaultFile) {
        String entity = required(dto.entity, "architecture entity");
        String file = dto.file != null ? dto.file : defaultFile;
        List<SignalDeclaration> signals = list(dto.signals).stream()
                .map(s -> new SignalDeclaration(required(s.name, "signal name in " + entity),
                        s.width != null ? ExpressionParser.parse(s.width) : null))
                .toList();
        List<ConstantDeclaration> constants = list(dto.constants).stream()
                .map(c -> new ConstantDeclaration(required(c.name, "constant name in " + entity),
                        ExpressionParser.parse(required(c.value, "value of constant " + c.name))))
                .toList();
        List<EnumerationType> types = list(dto.types).stream()
                .map(t -> new EnumerationType(required(t.name, "type name in " + entity), list(t.literals)))
                .toList();
        return Architecture.builder(dto.name != null ? dto.name : "rtl", entity)
                .signals(signals)
                .constants(constants)
                .types(types)
                .statements(concurrent(dto.statements, file))
                .build();
    }

    private List<ConcurrentStatement> concurrent(List<ConcurrentDto> statements, String file) {
        List<ConcurrentStatement> result = new ArrayList<>();
        for (ConcurrentDto dto : list(statements)) {
            if (dto.process != null) {
                ProcessDto p = dto.process;
                result.add(new ProcessStatement(required(p.label, "process label"), list(p.sensitivity),
                        sequential(p.body, file), location(file, p.line, p.column)));
            } else if (dto.instance != null) {
                InstanceDto i = dto.instance;
                result.add(new Instantiation(required(i.label, "instance label"), required(i.unit, "instantiated unit"),
                        expressions(i.generics), expressions(i.ports), location(file, i.line, i.column)));
            } else if (dto.generate != null) {
                GenerateDto g = dto.generate;
                String label = required(g.label, "generate label");
                result.add(new GenerateFor(label, required(g.variable, "loop variable of " + label),
                        ExpressionParser.parse(required(g.from, "lower bound of " + label)),
                        ExpressionParser.parse(required(g.to, "upper bound of " + label)),
                        concurrent(g.body, file), location(file, g.line, g.column)));
            } else if (dto.generateIf != null) {
                GenerateIfDto g = dto.generateIf;
                String label = required(g.label, "generate label");
                result.add(new GenerateIf(label, ExpressionParser.parse(required(g.condition, "condition of " + label)),
                        concurrent(g.body, file), location(file, g.line, g.column)));
            } else {
                throw new DesignLoadException("Concurrent statement of unknown kind in " + file);
            }
        }
        return result;
    }

    private List<SequentialStatement> sequential(List<SequentialDto> statements, String file) {
        List<SequentialStatement> result = new ArrayList<>();
        for (SequentialDto dto : list(statements)) {
            if (dto.assign != null) {
                AssignDto a = dto.assign;
                result.add(new Assignment(ExpressionParser.parse(required(a.target, "assignment target")),
                        ExpressionParser.parse(required(a.value, "assigned value")), location(file, a.line, a.column)));
            } else if (dto.ifStatement != null) {
                IfDto i = dto.ifStatement;
                List<Branch> branches = new ArrayList<>();
                for (BranchDto branch : list(i.branches)) {
                    branches.add(new Branch(ExpressionParser.parse(required(branch.condition, "if condition")),
                            sequential(branch.body, file)));
                }
                result.add(new IfStatement(branches,
                        Optional.ofNullable(i.elseBody).map(body -> sequential(body, file)),
                        location(file, i.line, i.column)));
            } else if (dto.caseStatement != null) {
                result.add(caseStatement(dto.caseStatement, file));
            } else if (dto.nullStatement != null) {
                result.add(new NullStatement(location(file, dto.nullStatement.line, dto.nullStatement.column)));
            } else {
                throw new DesignLoadException("Sequential statement of unknown kind in " + file);
            }
        }
        return result;
    }

    /**
     * An alternative whose only choice is {@code others} becomes the others branch.
     */
    private CaseStatement caseStatement(CaseDto dto, String file) {
        List<CaseAlternative> alternatives = new ArrayList<>();
        List<SequentialStatement> others = dto.others != null ? sequential(dto.others, file) : null;
        for (AlternativeDto alternative : list(dto.alternatives)) {
            List<String> choices = list(alternative.choices);
            if (choices.size() == 1 && choices.get(0).trim().equalsIgnoreCase("others")) {
                if (others != null) {
                    throw new DesignLoadException("Case statement with two others branches in " + file);
                }
                others = sequential(alternative.body, file);
                continue;
            }
            alternatives.add(new CaseAlternative(choices.stream().map(ExpressionParser::parse).toList(),
                    sequential(alternative.body, file)));
        }
        return new CaseStatement(ExpressionParser.parse(required(dto.selector, "case selector")), alternatives,
                Optional.ofNullable(others), location(file, dto.line, dto.column));
    }

    private Map<String, Expression> expressions(Map<String, String> raw) {
        Map<String, Expression> result = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((formal, actual) -> result.put(formal, ExpressionParser.parse(actual)));
        }
        return result;
    }

    private Direction direction(String direction) {
        if (direction == null) return Direction.IN;
        return switch (direction.toLowerCase(Locale.ROOT)) {
            case "in" -> Direction.IN;
            case "out", "buffer" -> Direction.OUT;
            case "inout" -> Direction.INOUT;
            default -> throw new DesignLoadException("Unknown port direction '" + direction + "'");
        };
    }

    private static Location location(String file, Integer line, Integer column) {
        return Location.at(file, line != null ? line : 0, column != null ? column : 0);
    }

    private static String required(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new DesignLoadException("Missing " + what);
        }
        return value;
    }

    private static <T> List<T> list(List<T> values) {
        return values != null ? values : List.of();
    }

    // DTO classes for JSON deserialization
    static class DesignDto {
        public String file;
        public List<UnitDto> units;
        public List<ArchitectureDto> architectures;
    }

    static class UnitDto {
        public String name;
        public String file;
        public Integer line;
        public Integer column;
        public List<GenericDto> generics;
        public List<PortDto> ports;
    }

    static class GenericDto {
        public String name;
        public String type;
        @JsonProperty("default")
        public String defaultValue;
    }

    static class PortDto {
        public String name;
        public String direction;
        public String width;
    }

    static class ArchitectureDto {
        public String name;
        public String entity;
        public String file;
        public List<DeclarationDto> signals;
        public List<DeclarationDto> constants;
        public List<TypeDto> types;
        public List<ConcurrentDto> statements;
    }

    static class DeclarationDto {
        public String name;
        public String width;
        public String value;
    }

    static class TypeDto {
        public String name;
        public List<String> literals;
    }

    static class ConcurrentDto {
        public ProcessDto process;
        public InstanceDto instance;
        public GenerateDto generate;
        public GenerateIfDto generateIf;
    }

    static class ProcessDto {
        public String label;
        public List<String> sensitivity;
        public List<SequentialDto> body;
        public Integer line;
        public Integer column;
    }

    static class InstanceDto {
        public String label;
        public String unit;
        public Map<String, String> generics;
        public Map<String, String> ports;
        public Integer line;
        public Integer column;
    }

    static class GenerateDto {
        public String label;
        public String variable;
        public String from;
        public String to;
        public List<ConcurrentDto> body;
        public Integer line;
        public Integer column;
    }

    static class GenerateIfDto {
        public String label;
        public String condition;
        public List<ConcurrentDto> body;
        public Integer line;
        public Integer column;
    }

    static class SequentialDto {
        public AssignDto assign;
        @JsonProperty("if")
        public IfDto ifStatement;
        @JsonProperty("case")
        public CaseDto caseStatement;
        @JsonProperty("null")
        public PositionDto nullStatement;
    }

    static class PositionDto {
        public Integer line;
        public Integer column;
    }

    static class AssignDto extends PositionDto {
        public String target;
        public String value;
    }

    static class IfDto extends PositionDto {
        public List<BranchDto> branches;
        @JsonProperty("else")
        public List<SequentialDto> elseBody;
    }

    static class BranchDto {
        public String condition;
        public List<SequentialDto> body;
    }

    static class CaseDto extends PositionDto {
        public String selector;
        public List<AlternativeDto> alternatives;
        public List<SequentialDto> others;
    }

    static class AlternativeDto {
        public List<String> choices;
        public List<SequentialDto> body;
    }
}
