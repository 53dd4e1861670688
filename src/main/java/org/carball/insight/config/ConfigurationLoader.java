package org.carball.insight.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public InsightConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public InsightConfig loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults, or the YAML file when one is given
        InsightConfig.InsightConfigBuilder builder = configFile != null
                ? loadFile(configFile).toBuilder()
                : InsightConfig.builder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        InsightConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML configuration file; absent keys keep their defaults.
     */
    public InsightConfig loadFile(Path configFile) {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        try {
            InsightConfig config = yamlMapper.readValue(configFile.toFile(), InsightConfig.class);
            log.info("Loaded configuration file {}", configFile);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file {}: {}", configFile, e.getMessage());
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(InsightConfig.InsightConfigBuilder builder) {
        Map<String, String> env = environment;

        if (env.containsKey("OPENAI_API_KEY")) {
            builder.openAiApiKey(env.get("OPENAI_API_KEY"));
        }
        if (env.containsKey("INSIGHT_OPENAI_BASE_URL")) {
            builder.openAiBaseUrl(env.get("INSIGHT_OPENAI_BASE_URL"));
        }
        if (env.containsKey("INSIGHT_MODEL")) {
            builder.model(env.get("INSIGHT_MODEL"));
        }
        if (env.containsKey("INSIGHT_JDBC_URL")) {
            builder.jdbcUrl(env.get("INSIGHT_JDBC_URL"));
        }
        if (env.containsKey("INSIGHT_DEFAULT_PERSONA")) {
            builder.defaultPersona(env.get("INSIGHT_DEFAULT_PERSONA"));
        }
        if (env.containsKey("INSIGHT_PERSONAS")) {
            builder.personas(splitList(env.get("INSIGHT_PERSONAS")));
        }
        if (env.containsKey("INSIGHT_COMPETITOR_BRANDS")) {
            builder.competitorBrands(splitList(env.get("INSIGHT_COMPETITOR_BRANDS")));
        }
        applyInt(env, "INSIGHT_QUERY_TIMEOUT_SECONDS", builder::queryTimeoutSeconds);
        applyInt(env, "INSIGHT_LLM_TIMEOUT_SECONDS", builder::llmTimeoutSeconds);
        applyInt(env, "INSIGHT_MAX_ROWS", builder::maxRows);
        applyInt(env, "INSIGHT_DISCOVERY_LIMIT", builder::discoveryLimit);
        applyInt(env, "INSIGHT_MAX_SELECTED_ITEMS", builder::maxSelectedItems);
    }

    private void applyCLIArguments(InsightConfig.InsightConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--insight.model":
                        builder.model(value);
                        break;
                    case "--insight.temperature":
                        builder.temperature(Double.parseDouble(value));
                        break;
                    case "--insight.jdbc-url":
                        builder.jdbcUrl(value);
                        break;
                    case "--insight.default-persona":
                        builder.defaultPersona(value);
                        break;
                    case "--insight.personas":
                        builder.personas(splitList(value));
                        break;
                    case "--insight.competitor-brands":
                        builder.competitorBrands(splitList(value));
                        break;
                    case "--insight.query-timeout":
                        builder.queryTimeoutSeconds(Integer.parseInt(value));
                        break;
                    case "--insight.llm-timeout":
                        builder.llmTimeoutSeconds(Integer.parseInt(value));
                        break;
                    case "--insight.max-rows":
                        builder.maxRows(Integer.parseInt(value));
                        break;
                    case "--insight.discovery-limit":
                        builder.discoveryLimit(Integer.parseInt(value));
                        break;
                    case "--insight.max-selected":
                        builder.maxSelectedItems(Integer.parseInt(value));
                        break;
                    case "--insight.compression-records":
                        builder.compressionMaxRecords(Integer.parseInt(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private void applyInt(Map<String, String> env, String name, IntConsumer setter) {
        if (!env.containsKey(name)) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(env.get(name).trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, env.get(name));
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --insight.model <name>               Chat model used for every AI call
              --insight.temperature <num>          Sampling temperature
              --insight.jdbc-url <url>             Warehouse JDBC URL
              --insight.default-persona <name>     Persona used when classification fails
              --insight.personas <a,b>             Personas offered to the classifier
              --insight.competitor-brands <a,b>    Brand names recognised by competitor mapping
              --insight.query-timeout <sec>        Store query timeout
              --insight.llm-timeout <sec>          Model call timeout
              --insight.max-rows <num>             Maximum rows fetched per query
              --insight.discovery-limit <num>      Candidates kept from discovery
              --insight.max-selected <num>         Candidates carried into analysis
              --insight.compression-records <num>  Records sent to the model per data sample

            Environment Variables:
              OPENAI_API_KEY                       OpenAI API key
              INSIGHT_OPENAI_BASE_URL              Alternative OpenAI-compatible endpoint
              INSIGHT_MODEL                        Same as --insight.model
              INSIGHT_JDBC_URL                     Same as --insight.jdbc-url
              INSIGHT_DEFAULT_PERSONA              Same as --insight.default-persona
              INSIGHT_PERSONAS                     Same as --insight.personas
              INSIGHT_COMPETITOR_BRANDS            Same as --insight.competitor-brands
              INSIGHT_QUERY_TIMEOUT_SECONDS        Same as --insight.query-timeout
              INSIGHT_LLM_TIMEOUT_SECONDS          Same as --insight.llm-timeout
              INSIGHT_MAX_ROWS                     Same as --insight.max-rows
              INSIGHT_DISCOVERY_LIMIT              Same as --insight.discovery-limit
              INSIGHT_MAX_SELECTED_ITEMS           Same as --insight.max-selected

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML configuration file (--config)
              4. Built-in defaults
            """;
    }
}
