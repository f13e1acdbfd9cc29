package com.docfusion.cli;

import com.docfusion.core.config.ConfigLoader;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.logging.Slf4jDocLogger;
import com.docfusion.core.plugin.CoreExtensions;
import com.docfusion.core.plugin.DocPlugin;
import com.docfusion.core.plugin.ExtensionPoint;
import com.docfusion.core.plugin.ExtensionRegistry;
import com.docfusion.core.plugin.PluginInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists discovered plugins in installation order and the implementations every core extension
 * point resolves to.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docfusion plugins
 * docfusion plugins -c docfusion.yaml
 * }</pre>
 */
@Command(
    name = "plugins",
    description = "List installed plugins and core extensions",
    mixinStandardHelpOptions = true
)
public class PluginsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PluginsCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: docfusion.yaml)")
    private Path configPath = Paths.get("docfusion.yaml");

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            DocFusionConfig config = ConfigLoader.loadOrDefaults(configPath);
            PluginInitializer initializer = new PluginInitializer(new Slf4jDocLogger());
            List<DocPlugin> plugins = initializer.order(
                initializer.combine(initializer.discover(PluginsCommand.class.getClassLoader()), List.of()));
            ExtensionRegistry registry = initializer.install(plugins, config);

            out.println("Plugins:");
            if (plugins.isEmpty()) {
                out.println("  No plugins found.");
            }
            plugins.forEach(plugin -> out.printf("  • %s (%s)%n", plugin.id(), plugin.getClass().getName()));
            out.println();

            out.println("Extensions:");
            for (ExtensionPoint<?> point : CoreExtensions.all()) {
                out.printf("  %s [%s]%n", point.name(), point.cardinality());
                List<ExtensionRegistry.Registration> registrations = registry.registrationsOf(point);
                if (registrations.isEmpty()) {
                    out.println("    (none)");
                }
                registrations.forEach(registration -> out.printf("    - %s from %s%n",
                    registration.implementation().getClass().getSimpleName(), registration.pluginId()));
            }
            return ExitCodes.OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        }
    }
}
