package com.exprtree.config;

import com.exprtree.exception.ConfigurationException;
import com.exprtree.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads driver configuration from YAML files.
 * <pre>
 * exprtree:
 *   name: demo
 *   max-depth: 64
 *   examples:
 *     - expression: "3 + x * (2 + y)"
 *       symbols: { x: 5, y: 1 }
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static DriverConfig load(String path) {
        log.info("Loading exprtree configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static DriverConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMapping(loaded, "Configuration root");

        // The section may sit at the root or under an 'exprtree' key
        Map<String, Object> section = root.containsKey("exprtree")
                ? asMapping(root.get("exprtree"), "'exprtree' section")
                : root;

        String name = getString(section, "name", "default");
        int maxDepth = getInt(section, "max-depth", Parser.UNLIMITED_DEPTH);
        if (maxDepth < 0) {
            throw new ConfigurationException("max-depth must be >= 0, got " + maxDepth);
        }

        List<ExampleConfig> examples = parseExamples(section.get("examples"));
        if (examples.isEmpty()) {
            log.warn("No examples configured in '{}'", name);
        }

        DriverConfig config = new DriverConfig(name, maxDepth, examples);
        log.info("Loaded exprtree configuration: {} with {} examples, max-depth: {}",
                name, examples.size(), maxDepth == Parser.UNLIMITED_DEPTH ? "unlimited" : maxDepth);
        return config;
    }

    @SuppressWarnings("unchecked")
    private static List<ExampleConfig> parseExamples(Object node) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List)) {
            throw new ConfigurationException("'examples' must be a list");
        }

        List<ExampleConfig> examples = new ArrayList<>();
        for (Object item : (List<Object>) node) {
            if (item instanceof String) {
                examples.add(new ExampleConfig((String) item, Map.of()));
            } else if (item instanceof Map) {
                examples.add(parseExample(asMapping(item, "Example entry")));
            } else {
                throw new ConfigurationException("Invalid example entry: " + item);
            }
        }
        return List.copyOf(examples);
    }

    @SuppressWarnings("unchecked")
    private static ExampleConfig parseExample(Map<String, Object> map) {
        Object expressionNode = map.get("expression");
        if (expressionNode == null) {
            throw new ConfigurationException("Example is missing 'expression': " + map);
        }
        if (!(expressionNode instanceof String)) {
            throw new ConfigurationException("'expression' must be a string, got: " + expressionNode);
        }
        String expression = (String) expressionNode;

        Object symbolsNode = map.get("symbols");
        if (symbolsNode == null) {
            return new ExampleConfig(expression, Map.of());
        }
        if (!(symbolsNode instanceof Map)) {
            throw new ConfigurationException("'symbols' of '" + expression + "' must be a mapping");
        }

        Map<String, Number> symbols = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) symbolsNode).entrySet()) {
            Object value = entry.getValue();
            if (!(value instanceof Integer || value instanceof Long
                    || value instanceof BigInteger || value instanceof Double)) {
                throw new ConfigurationException("Symbol '" + entry.getKey() + "' of '" + expression
                        + "' must be a number, got: " + value);
            }
            symbols.put(String.valueOf(entry.getKey()), (Number) value);
        }
        return new ExampleConfig(expression, Collections.unmodifiableMap(symbols));
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMapping(Object node, String what) {
        if (!(node instanceof Map)) {
            throw new ConfigurationException(what + " must be a mapping, got: " + node);
        }
        return (Map<String, Object>) node;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }
}
