package com.exprtree.adapter.spring;

import com.exprtree.config.ConfigLoader;
import com.exprtree.config.DriverConfig;
import com.exprtree.expression.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for exprtree.
 */
@Configuration
@ConditionalOnProperty(prefix = "exprtree", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ExprTreeProperties.class)
public class ExprTreeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExprTreeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DriverConfig driverConfig(ExprTreeProperties properties) {
        DriverConfig loaded = ConfigLoader.load(properties.getExamplesPath());
        if (properties.getMaxDepth() > 0) {
            return new DriverConfig(loaded.name(), properties.getMaxDepth(), loaded.examples());
        }
        return loaded;
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEvaluator expressionEvaluator(DriverConfig config) {
        log.info("Creating ExpressionEvaluator for '{}' (max-depth {})", config.name(), config.maxDepth());
        return new ExpressionEvaluator(config.maxDepth());
    }
}
