package com.docfusion.core.config;

import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.model.AnalysisPlatform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of a {@link DocFusionConfig}, run by callers before the pipeline.
 *
 * <p>The pipeline itself assumes a well-formed configuration.
 */
public final class ConfigValidator {

    private ConfigValidator() {
        // Utility class
    }

    /**
     * Validates a configuration and collects every violation.
     *
     * @param config configuration to validate
     * @return violation messages; empty if the configuration is valid
     */
    public static List<String> validate(DocFusionConfig config) {
        List<String> errors = new ArrayList<>();

        if (config.parallelism() <= 0) {
            errors.add("parallelism must be greater than zero, got " + config.parallelism());
        }
        if (config.passes().isEmpty()) {
            errors.add("at least one pass must be configured");
        }

        Set<String> seenPasses = new HashSet<>();
        for (int i = 0; i < config.passes().size(); i++) {
            PassConfig pass = config.passes().get(i);
            String where = "passes[" + i + "]";

            if (pass.moduleName() == null || pass.moduleName().isBlank()) {
                errors.add(where + ".moduleName must not be blank");
            }
            boolean knownPlatform = true;
            try {
                AnalysisPlatform.fromString(pass.platform());
            } catch (IllegalArgumentException e) {
                knownPlatform = false;
                errors.add(where + ".platform: " + e.getMessage());
            }
            if (knownPlatform && pass.moduleName() != null && !pass.moduleName().isBlank()) {
                String key = pass.moduleName() + "/" + pass.analysisPlatform().key() + "/" + pass.targets();
                if (!seenPasses.add(key)) {
                    errors.add(where + " duplicates module '" + pass.moduleName()
                        + "' on platform " + pass.analysisPlatform().key());
                }
            }
            if (pass.sourceRoots().isEmpty()) {
                errors.add(where + ".sourceRoots must not be empty");
            }
            for (PassConfig.SourceLink link : pass.sourceLinks()) {
                if (link.path() == null || link.url() == null) {
                    errors.add(where + ".sourceLinks entries need both path and url");
                } else if (link.path().contains("\\")) {
                    errors.add(where + ".sourceLinks path '" + link.path()
                        + "' is invalid, only Unix based paths are allowed");
                }
            }
            for (PassConfig.ExternalDocumentationLink link : pass.externalDocumentationLinks()) {
                if (link.url() == null || link.url().isBlank()) {
                    errors.add(where + ".externalDocumentationLinks entries need a url");
                }
            }
        }
        return errors;
    }

    /**
     * Validates a configuration and throws if it has any violation.
     *
     * @param config configuration to validate
     * @throws ConfigurationException listing every violation
     */
    public static void validateOrThrow(DocFusionConfig config) {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration:\n  - " + String.join("\n  - ", errors));
        }
    }
}
