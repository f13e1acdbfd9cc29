package com.docfusion.core.plugin;

import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.logging.DocLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Discovers, orders and installs plugins.
 *
 * <p><b>Initialization order</b> is service loader discovery order followed by explicitly
 * supplied plugins. An explicit plugin whose id matches a discovered one replaces it in place.
 * {@link DocPlugin#dependsOn()} and {@link DocPlugin#runsBefore()} refine that order through a
 * stable topological sort; when several plugins are ready, the one initialized first installs
 * first.
 */
public class PluginInitializer {

    private static final Logger log = LoggerFactory.getLogger(PluginInitializer.class);

    private final DocLogger logger;

    /**
     * Creates an initializer reporting unknown dependencies to the given logger.
     *
     * @param logger pipeline logger
     */
    public PluginInitializer(DocLogger logger) {
        this.logger = logger;
    }

    /**
     * Discovers plugins with the service loader of the given class loader.
     *
     * @param classLoader class loader to search
     * @return plugins in discovery order
     */
    public List<DocPlugin> discover(ClassLoader classLoader) {
        log.debug("Discovering plugins via ServiceLoader");
        List<DocPlugin> plugins = new ArrayList<>();
        ServiceLoader.load(DocPlugin.class, classLoader).forEach(plugins::add);
        log.debug("Discovered {} plugins", plugins.size());
        return plugins;
    }

    /**
     * Combines discovered and explicit plugins into initialization order.
     *
     * @param discovered plugins found by the service loader
     * @param explicit plugins supplied by the caller
     * @return plugins in initialization order
     * @throws ConfigurationException if two explicit plugins share an id
     */
    public List<DocPlugin> combine(List<DocPlugin> discovered, List<DocPlugin> explicit) {
        Map<String, DocPlugin> byId = new LinkedHashMap<>();
        for (DocPlugin plugin : discovered) {
            DocPlugin previous = byId.putIfAbsent(plugin.id(), plugin);
            if (previous != null) {
                log.warn("Plugin id '{}' discovered twice, keeping {}", plugin.id(), previous.getClass().getName());
            }
        }
        Set<String> explicitIds = new TreeSet<>();
        for (DocPlugin plugin : explicit) {
            if (!explicitIds.add(plugin.id())) {
                throw new ConfigurationException("Plugin id '" + plugin.id() + "' was supplied more than once");
            }
            if (byId.containsKey(plugin.id())) {
                log.debug("Explicit plugin {} replaces discovered plugin with the same id", plugin.id());
            }
            byId.put(plugin.id(), plugin);
        }
        return List.copyOf(byId.values());
    }

    /**
     * Sorts plugins so that every plugin installs after the plugins it depends on and before
     * the plugins it runs before.
     *
     * @param plugins plugins in initialization order, with unique ids
     * @return plugins in installation order
     * @throws ConfigurationException if the declarations form a cycle
     */
    public List<DocPlugin> order(List<DocPlugin> plugins) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < plugins.size(); i++) {
            index.put(plugins.get(i).id(), i);
        }

        List<List<Integer>> successors = new ArrayList<>();
        int[] inDegree = new int[plugins.size()];
        for (int i = 0; i < plugins.size(); i++) {
            successors.add(new ArrayList<>());
        }

        for (int i = 0; i < plugins.size(); i++) {
            DocPlugin plugin = plugins.get(i);
            for (String dependency : new TreeSet<>(plugin.dependsOn())) {
                Integer from = lookup(index, plugin, dependency, "depends on");
                if (from != null) {
                    successors.get(from).add(i);
                    inDegree[i]++;
                }
            }
            for (String later : new TreeSet<>(plugin.runsBefore())) {
                Integer to = lookup(index, plugin, later, "runs before");
                if (to != null) {
                    successors.get(i).add(to);
                    inDegree[to]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < plugins.size(); i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }

        List<DocPlugin> ordered = new ArrayList<>(plugins.size());
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(plugins.get(current));
            for (int next : successors.get(current)) {
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }

        if (ordered.size() < plugins.size()) {
            List<String> blocked = new ArrayList<>();
            for (int i = 0; i < plugins.size(); i++) {
                if (inDegree[i] > 0) {
                    blocked.add(plugins.get(i).id());
                }
            }
            throw new ConfigurationException("Cyclic plugin dependencies between: " + String.join(", ", blocked));
        }
        return ordered;
    }

    /**
     * Installs plugins in order into a fresh registry.
     *
     * @param ordered plugins in installation order
     * @param config run configuration
     * @return frozen registry
     */
    public ExtensionRegistry install(List<DocPlugin> ordered, DocFusionConfig config) {
        ExtensionRegistry.Builder builder = ExtensionRegistry.builder();
        for (DocPlugin plugin : ordered) {
            log.debug("Installing plugin: {} ({})", plugin.id(), plugin.getClass().getName());
            builder.forPlugin(plugin.id());
            plugin.install(builder, config);
        }
        builder.forPlugin(null);
        return builder.build();
    }

    private Integer lookup(Map<String, Integer> index, DocPlugin plugin, String otherId, String relation) {
        Integer other = index.get(otherId);
        if (other == null) {
            logger.warn("Plugin '" + plugin.id() + "' " + relation + " unknown plugin '" + otherId + "', ignoring");
        }
        return other;
    }
}
