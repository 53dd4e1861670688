package org.carball.insight.tools;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.tool.ToolDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only mapping of persona to its direct tools in registration order. Built once through
 * {@link Builder}; safe to share between concurrent requests.
 */
@Slf4j
public final class DirectToolRegistry {

    private final Map<String, List<ToolDescriptor>> toolsByPersona;

    private DirectToolRegistry(Map<String, List<ToolDescriptor>> toolsByPersona) {
        this.toolsByPersona = toolsByPersona;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DirectToolRegistry empty() {
        return new DirectToolRegistry(Map.of());
    }

    /**
     * Tools registered for the persona, in registration order; empty for an unknown persona.
     */
    public List<ToolDescriptor> toolsFor(String persona) {
        if (persona == null) {
            return List.of();
        }
        return toolsByPersona.getOrDefault(persona, List.of());
    }

    public Optional<ToolDescriptor> find(String persona, String toolName) {
        return toolsFor(persona).stream()
                .filter(tool -> tool.name().equals(toolName))
                .findFirst();
    }

    public Set<String> personas() {
        return toolsByPersona.keySet();
    }

    public RegistryStats stats() {
        Map<String, List<String>> names = new LinkedHashMap<>();
        toolsByPersona.forEach((persona, tools) -> names.put(persona,
                tools.stream().map(ToolDescriptor::name).collect(Collectors.toList())));
        int toolCount = toolsByPersona.values().stream().mapToInt(List::size).sum();
        return new RegistryStats(toolsByPersona.size(), toolCount, Collections.unmodifiableMap(names));
    }

    /**
     * Runs one tool's predicate over sample questions. Useful when tuning a predicate.
     */
    public Map<String, Boolean> testPredicate(String persona, String toolName, List<String> questions,
                                              ClassificationRecord classification) {
        ToolDescriptor tool = find(persona, toolName)
                .orElseThrow(() -> new IllegalArgumentException("No tool '" + toolName + "' for persona " + persona));
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String question : questions) {
            results.put(question, tool.predicate().test(question, classification));
        }
        return results;
    }

    public static final class Builder {

        private final Map<String, List<ToolDescriptor>> pending = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder register(String persona, ToolDescriptor tool) {
            if (built) {
                throw new IllegalStateException("Registry already built; tools cannot be added");
            }
            if (persona == null || persona.isBlank()) {
                throw new IllegalArgumentException("Persona is required to register a tool");
            }
            validate(persona, tool);
            List<ToolDescriptor> tools = pending.computeIfAbsent(persona, p -> new ArrayList<>());
            if (tools.stream().anyMatch(existing -> existing.name().equals(tool.name()))) {
                throw new IllegalArgumentException("Duplicate tool '" + tool.name() + "' for persona " + persona);
            }
            tools.add(tool);
            return this;
        }

        /**
         * Declares a persona that has no direct tools yet.
         */
        public Builder persona(String persona) {
            if (built) {
                throw new IllegalStateException("Registry already built; personas cannot be added");
            }
            pending.computeIfAbsent(persona, p -> new ArrayList<>());
            return this;
        }

        public DirectToolRegistry build() {
            if (built) {
                throw new IllegalStateException("Registry already built");
            }
            built = true;
            Map<String, List<ToolDescriptor>> frozen = new LinkedHashMap<>();
            pending.forEach((persona, tools) -> frozen.put(persona, List.copyOf(tools)));
            DirectToolRegistry registry = new DirectToolRegistry(Collections.unmodifiableMap(frozen));
            log.info("Direct tool registry built: {}", registry.stats().toolsByPersona());
            return registry;
        }

        private static void validate(String persona, ToolDescriptor tool) {
            if (tool == null) {
                throw new IllegalArgumentException("Tool descriptor is required for persona " + persona);
            }
            Set<String> missing = new HashSet<>();
            if (tool.name() == null || tool.name().isBlank()) {
                missing.add("name");
            }
            if (tool.predicate() == null) {
                missing.add("predicate");
            }
            if (tool.executor() == null) {
                missing.add("executor");
            }
            if (tool.description() == null || tool.description().isBlank()) {
                missing.add("description");
            }
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("Tool for persona " + persona + " is missing " + missing);
            }
        }
    }
}
