package org.carball.insight.persona;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.stage.StageName;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persona knowledge modules and stage prompt templates, loaded once from the classpath.
 */
@Slf4j
public class PersonaCatalog {

    private static final String PERSONA_PATH = "personas/%s.md";
    private static final String TEMPLATE_PATH = "intent/%s.md";
    private static final Pattern TABLE_NAME = Pattern.compile("\\b(JPN[A-Za-z]+db_\\w+)\\b");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final int MAX_DESCRIPTION = 100;

    private final Map<String, Persona> personas;
    private final Map<StageName, String> templates;

    public PersonaCatalog(List<String> personaNames) {
        Map<String, Persona> loaded = new LinkedHashMap<>();
        for (String name : personaNames) {
            String content = readResource(String.format(PERSONA_PATH, name));
            if (content == null) {
                log.warn("Persona module '{}' not found on classpath", name);
                continue;
            }
            loaded.put(name, new Persona(name, describe(content), extractTables(content), content));
        }
        this.personas = Collections.unmodifiableMap(loaded);

        Map<StageName, String> stageTemplates = new EnumMap<>(StageName.class);
        for (StageName stage : List.of(StageName.DISCOVERY, StageName.ANALYSIS, StageName.EVALUATION)) {
            String template = readResource(String.format(TEMPLATE_PATH, stage.getKey()));
            if (template == null) {
                log.warn("Intent template '{}' not found on classpath", stage.getKey());
            } else {
                stageTemplates.put(stage, template);
            }
        }
        this.templates = Collections.unmodifiableMap(stageTemplates);

        log.info("Loaded {} personas {} and {} stage templates", personas.size(), personas.keySet(), templates.size());
    }

    public boolean hasPersona(String name) {
        return name != null && personas.containsKey(name);
    }

    public Optional<Persona> get(String name) {
        return Optional.ofNullable(personas.get(name));
    }

    public List<String> names() {
        return new ArrayList<>(personas.keySet());
    }

    /**
     * Full knowledge module for a persona, or a placeholder line when it is unknown.
     */
    public String content(String name) {
        Persona persona = personas.get(name);
        return persona != null ? persona.content() : "Persona module '" + name + "' not available.";
    }

    public String template(StageName stage) {
        String template = templates.get(stage);
        return template != null ? template : "Stage " + stage.getKey() + ": answer the user question.";
    }

    /**
     * One entry per persona with its description and tables, for the classification prompt.
     */
    public String describeForClassifier() {
        StringBuilder list = new StringBuilder();
        for (Persona persona : personas.values()) {
            list.append("- ").append(persona.name()).append(": ").append(persona.description()).append('\n');
            list.append("  Tables: ")
                    .append(persona.tables().isEmpty() ? "No specific tables" : String.join(", ", persona.tables()))
                    .append('\n');
        }
        return list.toString();
    }

    /**
     * Replaces {@code {name}} placeholders; unknown placeholders are left as they are.
     */
    public static String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    static String describe(String content) {
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return trimmed.length() > MAX_DESCRIPTION ? trimmed.substring(0, MAX_DESCRIPTION) + "..." : trimmed;
            }
        }
        return "Available persona";
    }

    static List<String> extractTables(String content) {
        Set<String> tables = new LinkedHashSet<>();
        Matcher matcher = TABLE_NAME.matcher(content);
        while (matcher.find()) {
            tables.add(matcher.group(1));
        }
        return new ArrayList<>(tables);
    }

    private String readResource(String path) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", path, e.getMessage(), e);
            return null;
        }
    }
}
