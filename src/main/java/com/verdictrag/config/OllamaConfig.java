package com.verdictrag.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${spring.ai.ollama.chat.options.model:llama3.1:8b}")
    private String model;

    @Value("${spring.ai.ollama.chat.options.temperature:0.1}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.num-predict:2048}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:40}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {}", baseUrl);
        return OllamaApi.builder().baseUrl(baseUrl).build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // Max output tokens
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .build();
    }

    @Bean
    public ModelManagementOptions modelManagementOptions() {
        return ModelManagementOptions.builder().build();
    }

    @Bean
    public OllamaChatModel ollamaChatModel(
            OllamaApi ollamaApi,
            OllamaOptions defaultOllamaOptions,
            ObjectProvider<ObservationRegistry> observationRegistry,
            ModelManagementOptions modelManagementOptions) {

        log.info("Ollama chat model: {} (temperature={}, numPredict={})", model, temperature, numPredict);

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(defaultOllamaOptions)
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(modelManagementOptions)
                .build();
    }

    /**
     * Threads that run blocking chat calls so the caller can enforce a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService llmExecutor(LegalRagProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getLlm().getMaxConcurrentCalls(), threadFactory);
    }
}
