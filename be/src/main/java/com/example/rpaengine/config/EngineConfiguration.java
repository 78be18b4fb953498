package com.example.rpaengine.config;

import com.example.rpaengine.compiler.ProjectCompiler;
import com.example.rpaengine.expression.DefaultExpressionEvaluator;
import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.interpreter.Interpreter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine beans. Limits come from {@code rpa.engine.*} properties.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new DefaultExpressionEvaluator();
    }

    @Bean
    public ProjectCompiler projectCompiler(ExpressionEvaluator expressionEvaluator) {
        return new ProjectCompiler(expressionEvaluator);
    }

    @Bean
    public Interpreter interpreter(
            ExpressionEvaluator expressionEvaluator,
            @Value("${rpa.engine.max-call-depth:100}") int maxCallDepth,
            @Value("${rpa.engine.max-steps:0}") long maxSteps) {
        return new Interpreter(expressionEvaluator, maxCallDepth, maxSteps);
    }

    /**
     * Threads for asynchronous runs; each run occupies one thread until it finishes.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runExecutor(@Value("${rpa.engine.run-threads:2}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "scenario-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
