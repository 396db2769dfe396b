package com.example.workflowsynth.config;

import com.example.workflowsynth.assembly.GraphAssembler;
import com.example.workflowsynth.fragment.FragmentParser;
import com.example.workflowsynth.fragment.FragmentRepairer;
import com.example.workflowsynth.repair.GlobalConnectivityRepairer;
import com.example.workflowsynth.validation.NodeTypeCatalog;
import com.example.workflowsynth.validation.StructuralValidator;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import tools.jackson.databind.json.JsonMapper;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SynthesisProperties.class)
@Slf4j
public class EngineConfiguration {

    @Bean
    public FragmentParser fragmentParser(JsonMapper jsonMapper) {
        return new FragmentParser(jsonMapper);
    }

    @Bean
    public FragmentRepairer fragmentRepairer() {
        return new FragmentRepairer();
    }

    @Bean
    public GraphAssembler graphAssembler() {
        return new GraphAssembler();
    }

    @Bean
    public GlobalConnectivityRepairer globalConnectivityRepairer() {
        return new GlobalConnectivityRepairer();
    }

    @Bean
    public NodeTypeCatalog nodeTypeCatalog() {
        return NodeTypeCatalog.standard();
    }

    @Bean
    public StructuralValidator structuralValidator(NodeTypeCatalog catalog, SynthesisProperties properties) {
        return new StructuralValidator(catalog, properties.getValidation().toThresholds());
    }

    /** Bounded pool for concurrent fragment generation calls. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService fragmentGenerationExecutor(SynthesisProperties properties) {
        int threads = Math.max(1, properties.getGeneration().getMaxConcurrency());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "fragment-gen-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Fragment generation pool maxConcurrency={} timeout={}", threads, properties.getGeneration().getTimeout());
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
