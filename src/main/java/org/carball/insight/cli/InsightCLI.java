package org.carball.insight.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.ConfigurationLoader;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.model.response.ResponseEnvelope;
import org.carball.insight.model.tool.ToolDescriptor;
import org.carball.insight.orchestrator.OrchestratorFactory;
import org.carball.insight.orchestrator.QuestionOrchestrator;
import org.carball.insight.output.AnswerReport;
import org.carball.insight.output.OutputFormat;
import org.carball.insight.store.WarehouseConnector;
import org.carball.insight.tools.DirectToolCatalog;
import org.carball.insight.tools.DirectToolRegistry;
import org.carball.insight.tools.RegistryStats;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

@Slf4j
public class InsightCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            Business Insight Orchestrator v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.isVerbose()) {
                ((Logger) LoggerFactory.getLogger("org.carball.insight")).setLevel(Level.DEBUG);
            }

            InsightConfig config = new ConfigurationLoader().loadConfiguration(options.getConfigFile(), args);
            if (options.getOpenAiApiKey() != null) {
                config.setOpenAiApiKey(options.getOpenAiApiKey());
            }

            if (options.isListTools()) {
                printTools(DirectToolCatalog.standard(new WarehouseConnector(config), config));
                return;
            }

            if (options.getQuestion() == null || options.getQuestion().isBlank()) {
                throw new IllegalArgumentException("Question not specified");
            }

            System.out.println("\n🔍 Answering question...");
            System.out.println("   Question: " + options.getQuestion());
            System.out.println("   Model: " + config.getModel() + (config.isAiConfigured() ? "" : " (not configured)"));
            System.out.println("   Warehouse: " + (config.isWarehouseConfigured() ? "configured" : "not configured"));
            System.out.println();

            // Step 1: Wire the orchestrator
            System.out.print("📊 Loading personas and direct tools... ");
            QuestionOrchestrator orchestrator = OrchestratorFactory.create(config);
            System.out.println("✓");

            // Step 2: Answer
            System.out.print("🤖 Routing and answering... ");
            ResponseEnvelope envelope = orchestrator.handle(options.getQuestion());
            System.out.println(envelope.degraded() ? "⚠️ (degraded)" : "✓");

            // Step 3: Render
            AnswerReport report = new AnswerReport(envelope);
            String rendered = options.getOutputFormat() == OutputFormat.JSON ? report.toJson() : report.toMarkdown();
            if (options.getOutputFile() != null) {
                System.out.print("📝 Writing results... ");
                Files.writeString(Paths.get(options.getOutputFile()), rendered);
                System.out.println("✓");
            } else {
                System.out.println();
                System.out.println(rendered);
            }

            printSummary(envelope);
            System.out.println("\n✅ Done!");
            if (options.getOutputFile() != null) {
                System.out.println("   Output file: " + options.getOutputFile());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar insight-orchestrator.jar \"<question>\" [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  question            Business question in natural language");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Write the answer to a file instead of the console");
        System.out.println("  --format, -f        Output format: json|markdown (default: markdown)");
        System.out.println("  --config            YAML configuration file (optional)");
        System.out.println("  --api-key           OpenAI API key (or set OPENAI_API_KEY env var)");
        System.out.println("  --list-tools        List the direct tools registered per persona and exit");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  # Competitor equivalent lookup");
        System.out.println("  java -jar insight-orchestrator.jar \"What is our equivalent of Hogy product ABC-123?\"");
        System.out.println();
        System.out.println("  # Multi-stage analysis written as JSON");
        System.out.println("  java -jar insight-orchestrator.jar \"Which drape kits are most profitable?\" -f json -o answer.json");
        System.out.println();
        System.out.println("Environment Variables:");
        System.out.println("  OPENAI_API_KEY      Your OpenAI API key");
        System.out.println("  INSIGHT_JDBC_URL    Warehouse JDBC connection string");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    options.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json or markdown");
                    }
                    break;

                case "--config":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Configuration file not specified");
                    }
                    options.setConfigFile(Path.of(args[++i]));
                    break;

                case "--api-key":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("API key not specified");
                    }
                    options.setOpenAiApiKey(args[++i]);
                    break;

                case "--list-tools":
                    options.setListTools(true);
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--insight.")) {
                        // Value is applied by ConfigurationLoader
                        i++;
                    } else if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    } else if (options.getQuestion() == null) {
                        options.setQuestion(args[i]);
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + args[i]
                                + " (quote the question if it contains spaces)");
                    }
            }
        }
        return options;
    }

    private static void printTools(DirectToolRegistry registry) {
        RegistryStats stats = registry.stats();
        System.out.println("\n🧰 Direct tools (" + stats.toolCount() + " across " + stats.personaCount() + " personas)");
        for (String persona : registry.personas()) {
            System.out.println("\n   " + persona);
            for (ToolDescriptor tool : registry.toolsFor(persona)) {
                System.out.println("     - " + tool.name() + ": " + tool.description());
                tool.exampleTriggers().forEach(example -> System.out.println("         e.g. \"" + example + "\""));
            }
        }
    }

    private static void printSummary(ResponseEnvelope envelope) {
        System.out.println("\n📋 Summary:");
        System.out.println("   Path: " + envelope.executionPath());
        if (envelope.classification() != null) {
            System.out.println("   Persona: " + envelope.classification().persona());
        }
        System.out.println("   Stages: " + String.join(", ", envelope.stageResults().keySet()));
        System.out.println("   Duration: " + envelope.durationMs() + " ms");
        envelope.notes().forEach(note -> System.out.println("   💡 " + note));
    }
}
