package com.docfusion.cli;

import com.docfusion.core.config.ConfigLoader;
import com.docfusion.core.config.ConfigValidator;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Validates a configuration file without running the pipeline.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = "docfusion.yaml")
    private Path configFile;

    @Override
    public Integer call() {
        log.debug("Validating configuration: {}", configFile);
        PrintWriter out = spec.commandLine().getOut();

        List<String> violations;
        try {
            violations = ConfigValidator.validate(ConfigLoader.load(configFile));
        } catch (ConfigurationException e) {
            out.println("Invalid configuration: " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        }

        if (violations.isEmpty()) {
            out.println("Configuration is valid: " + configFile);
            return ExitCodes.OK;
        }
        out.println("Configuration has " + violations.size() + " problem(s):");
        violations.forEach(violation -> out.println("  - " + violation));
        return ExitCodes.CONFIGURATION_ERROR;
    }
}
