package com.exprtree.config;

import com.exprtree.parser.Parser;

import java.util.List;

/**
 * Root configuration for the example driver.
 *
 * @param name     Configuration name
 * @param maxDepth Parenthesis nesting limit passed to the parser
 * @param examples Expressions to evaluate, in order
 */
public record DriverConfig(
        String name,
        int maxDepth,
        List<ExampleConfig> examples
) {
    /**
     * Create a configuration with no examples, for testing.
     */
    public static DriverConfig empty() {
        return new DriverConfig("empty", Parser.UNLIMITED_DEPTH, List.of());
    }
}
