package org.carball.insight.cli;

import lombok.Data;
import org.carball.insight.output.OutputFormat;

import java.nio.file.Path;

@Data
public class CliOptions {
    private String question;
    private Path configFile;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.MARKDOWN;
    private String openAiApiKey;
    private boolean verbose;
    private boolean listTools;
}
