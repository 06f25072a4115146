package com.exprtree.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for exprtree.
 */
@ConfigurationProperties(prefix = "exprtree")
public class ExprTreeProperties {

    /**
     * Whether exprtree beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the driver's examples file.
     * Supports classpath: prefix for classpath resources.
     */
    private String examplesPath = "classpath:exprtree-examples.yaml";

    /**
     * Parenthesis nesting limit; 0 means unlimited. Overrides the file's max-depth when positive.
     */
    private int maxDepth = 0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getExamplesPath() {
        return examplesPath;
    }

    public void setExamplesPath(String examplesPath) {
        this.examplesPath = examplesPath;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
}
