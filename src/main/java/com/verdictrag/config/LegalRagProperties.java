package com.verdictrag.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline configuration bound from {@code legal-rag.*}.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "legal-rag")
public class LegalRagProperties {

    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Llm llm = new Llm();
    private Quality quality = new Quality();
    private Registry registry = new Registry();
    private Index index = new Index();
    private Monitoring monitoring = new Monitoring();

    // ============================================================
    // Chunking
    // ============================================================
    @Data
    public static class Chunking {
        /**
         * Maximum chunk length in characters
         */
        private Integer targetSize = 1000;
        private Integer overlap = 200;
        /**
         * Split separators, highest priority first. A hard cut is used when none applies.
         */
        private List<String> separators = new ArrayList<>(List.of(
                "\n\n", "\n", ". ", "? ", "! ", "; ", " "));
    }

    // ============================================================
    // Embedding
    // ============================================================
    @Data
    public static class Embedding {
        /**
         * hashing (local, deterministic) or remote (HTTP embedding service)
         */
        private String provider = "hashing";
        private Integer dimension = 384;
        private Integer timeoutSeconds = 60;
        private String baseUrl = "http://localhost:8000";
        private String model = "all-MiniLM-L6-v2";
    }

    // ============================================================
    // Retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer topK = 5;
        private Integer maxSources = 3;
        private Integer maxHistoryTurns = 5;
    }

    // ============================================================
    // LLM
    // ============================================================
    @Data
    public static class Llm {
        private Integer timeoutSeconds = 120;
        private Integer maxConcurrentCalls = 8;
    }

    // ============================================================
    // Quality validation
    // ============================================================
    @Data
    public static class Quality {
        private Double expectedTermDensity = 5.0;
        private Integer hedgingAllowance = 3;
        private Double hedgingPenalty = 0.1;
        private Double validityThreshold = 0.7;
        private Double terminologyThreshold = 0.6;
        private Double relevanceThreshold = 0.5;
        private Double hedgingThreshold = 0.8;
    }

    // ============================================================
    // Citation registry & patterns
    // ============================================================
    @Data
    public static class Registry {
        private String seedPath = "classpath:citations/sa-citation-registry.json";
        private String patternsPath = "classpath:citation-patterns/sa-v1.json";
    }

    // ============================================================
    // Index persistence
    // ============================================================
    @Data
    public static class Index {
        /**
         * GZIP snapshot file; persistence is off when blank
         */
        private String snapshotPath;
    }

    // ============================================================
    // Monitoring
    // ============================================================
    @Data
    public static class Monitoring {
        private Boolean enabled = true;
        private Integer maxQueryHistory = 100;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getTopK() {
        return retrieval.getTopK();
    }

    public int getMaxHistoryTurns() {
        return retrieval.getMaxHistoryTurns();
    }

    public int getDimension() {
        return embedding.getDimension();
    }

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("LEGAL RAG CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  Chunking  : target={} overlap={}", chunking.getTargetSize(), chunking.getOverlap());
        log.info("  Embedding : provider={} dimension={}", embedding.getProvider(), embedding.getDimension());
        log.info("  Retrieval : topK={} maxSources={} history={}",
                retrieval.getTopK(), retrieval.getMaxSources(), retrieval.getMaxHistoryTurns());
        log.info("  LLM       : timeout={}s", llm.getTimeoutSeconds());
        log.info("  Registry  : {}", registry.getSeedPath());
        log.info("=".repeat(70));
    }
}
