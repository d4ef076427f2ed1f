package com.verdictrag.config;

import java.time.Duration;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.verdictrag.service.embedding.EmbeddingFunction;
import com.verdictrag.service.embedding.HashingEmbeddingFunction;
import com.verdictrag.service.embedding.RemoteEmbeddingFunction;
import com.verdictrag.util.LegalTokenizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EmbeddingConfig {

    private final LegalRagProperties properties;

    @Bean
    public WebClient embeddingWebClient() {
        LegalRagProperties.Embedding embedding = properties.getEmbedding();
        return WebClient.builder()
                .baseUrl(embedding.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))))
                .build();
    }

    @Bean
    public EmbeddingFunction embeddingFunction(WebClient embeddingWebClient, LegalTokenizer tokenizer,
            CacheManager cacheManager) {
        LegalRagProperties.Embedding embedding = properties.getEmbedding();

        log.info("==============================================");
        log.info("EMBEDDING CONFIGURATION");
        log.info("==============================================");
        log.info("  Provider  : {}", embedding.getProvider());
        log.info("  Dimension : {}", embedding.getDimension());

        if ("remote".equalsIgnoreCase(embedding.getProvider())) {
            log.info("  Base URL  : {}", embedding.getBaseUrl());
            log.info("  Model     : {}", embedding.getModel());
            log.info("  Timeout   : {}s", embedding.getTimeoutSeconds());
            log.info("==============================================");
            Cache cache = cacheManager.getCache("embeddings");
            if (cache == null) {
                throw new IllegalStateException("Cache 'embeddings' is not configured");
            }
            return new RemoteEmbeddingFunction(embedding, embeddingWebClient, cache);
        }
        if (!"hashing".equalsIgnoreCase(embedding.getProvider())) {
            throw new IllegalStateException("Unknown embedding provider: " + embedding.getProvider());
        }
        log.info("==============================================");
        return new HashingEmbeddingFunction(tokenizer, embedding.getDimension());
    }
}
