package com.exprtree;

import com.exprtree.config.DriverConfig;
import com.exprtree.config.ExampleConfig;
import com.exprtree.exception.ExprTreeException;
import com.exprtree.expression.EvaluationResult;
import com.exprtree.expression.ExpressionEvaluator;
import com.exprtree.spring.EnableExprTree;
import com.exprtree.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application that evaluates the configured expressions and
 * logs each decorated tree.
 */
@SpringBootApplication
@EnableExprTree
public class ExprTreeApplication {

    private static final Logger log = LoggerFactory.getLogger(ExprTreeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ExprTreeApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DriverConfig config, ExpressionEvaluator evaluator) {
        return args -> {
            log.info("=== Decorated AST Demo Started ===");

            int failures = 0;
            for (ExampleConfig example : config.examples()) {
                log.info("Expression: {}", example.expression());

                // Each expression gets its own table
                SymbolTable symbols = example.symbolTable();
                log.info("{}", symbols.describe());

                try {
                    EvaluationResult result = evaluator.evaluate(example.expression(), symbols);
                    log.info("Value: {}", result.value());
                    log.info("Decorated AST:\n{}", result.tree());
                } catch (ExprTreeException e) {
                    failures++;
                    log.warn("{} error in '{}': {}", e.kind(), example.expression(), e.getMessage());
                }
            }

            log.info("=== Demo Completed: {} expressions, {} failed ===", config.examples().size(), failures);
        };
    }
}
