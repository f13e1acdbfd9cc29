package com.docfusion.cli;

import com.docfusion.core.DocGenerator;
import com.docfusion.core.GenerationReport;
import com.docfusion.core.analysis.impl.JavaParserAnalysisEnvironmentFactory;
import com.docfusion.core.config.ConfigLoader;
import com.docfusion.core.config.ConfigValidator;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.exception.StageFailureException;
import com.docfusion.core.logging.Slf4jDocLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Runs the documentation pipeline.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docfusion generate
 * docfusion generate -c docs/docfusion.yaml -d . -o build/docs --format markdown
 * }</pre>
 *
 * <p>Exit codes are listed in {@link ExitCodes}.
 */
@Command(
    name = "generate",
    description = "Analyze, merge, transform and render documentation",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: docfusion.yaml)")
    private Path configPath = Paths.get("docfusion.yaml");

    @Option(names = {"-d", "--base-dir"}, description = "Directory relative paths resolve against (default: .)")
    private Path baseDir = Paths.get(".");

    @Option(names = {"-o", "--output"}, description = "Output directory, overrides the configuration")
    private Path outputDir;

    @Option(names = {"-f", "--format"}, description = "Output format, overrides the configuration")
    private String format;

    @Option(names = "--fail-on-analysis-error", description = "Exit with code 3 when analysis reports errors")
    private Boolean failOnAnalysisError;

    @Override
    public Integer call() {
        try {
            DocFusionConfig config = loadConfiguration();
            ConfigValidator.validateOrThrow(config);

            log.info("Generating documentation for {} pass(es) into {}", config.passes().size(), config.outputDir());
            GenerationReport report = new DocGenerator(config, new Slf4jDocLogger(),
                new JavaParserAnalysisEnvironmentFactory(baseDir)).generate();

            boolean failOnErrors = failOnAnalysisError != null ? failOnAnalysisError : config.failOnAnalysisError();
            if (report.analysisErrors() && failOnErrors) {
                log.error("Analysis reported errors");
                return ExitCodes.ANALYSIS_ERRORS;
            }
            return ExitCodes.OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (StageFailureException e) {
            log.error("Generation failed at stage '{}': {}", e.getStage().progressMessage(), e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Stack trace:", e);
            }
            return ExitCodes.STAGE_FAILURE;
        }
    }

    private DocFusionConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : baseDir.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        DocFusionConfig config = ConfigLoader.loadOrDefaults(absoluteConfigPath);

        if (format != null) {
            config = config.withFormat(format);
        }
        Path output = outputDir != null ? outputDir : Paths.get(config.outputDir());
        if (!output.isAbsolute()) {
            output = baseDir.resolve(output);
        }
        return config.withOutputDir(output.normalize().toString());
    }
}
