package com.verdictrag.config;

import java.io.IOException;
import java.io.InputStream;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import com.verdictrag.exception.RagException;
import com.verdictrag.service.citation.CitationPatternCatalog;
import com.verdictrag.service.embedding.EmbeddingFunction;
import com.verdictrag.service.index.InMemoryEmbeddingIndex;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public CitationPatternCatalog citationPatternCatalog(LegalRagProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getRegistry().getPatternsPath();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RagException("Citation pattern catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return CitationPatternCatalog.load(in);
        } catch (IOException e) {
            throw new RagException("Failed to read citation pattern catalog " + location, e);
        }
    }

    @Bean
    public InMemoryEmbeddingIndex embeddingIndex(EmbeddingFunction embeddingFunction, LegalRagProperties properties) {
        return new InMemoryEmbeddingIndex(embeddingFunction, properties.getDimension());
    }
}
