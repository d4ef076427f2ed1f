package com.verdictrag.service.data;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.exception.RagException;
import com.verdictrag.model.CitationReference;
import com.verdictrag.service.quality.CitationRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds the citation registry from a JSON array of {@link CitationReference} records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CitationRegistryLoader {

    private final CitationRegistry registry;
    private final ResourceLoader resourceLoader;
    private final LegalRagProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile boolean loaded = false;

    /**
     * Load the configured seed file once. Later calls are no-ops.
     *
     * @return number of records registered by this call
     */
    public synchronized int loadSeed() {
        if (loaded) {
            log.info("Citation registry already seeded, skipping");
            return 0;
        }

        String location = properties.getRegistry().getSeedPath();
        if (location == null || location.isBlank()) {
            log.warn("No citation registry seed configured; registry starts empty");
            loaded = true;
            return 0;
        }

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RagException("Citation registry seed not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            int count = load(in);
            loaded = true;
            log.info("Citation registry seeded from {} ({} records)", location, count);
            return count;
        } catch (IOException e) {
            throw new RagException("Failed to read citation registry seed " + location, e);
        }
    }

    public int load(InputStream in) throws IOException {
        List<CitationReference> references = objectMapper.readValue(in, new TypeReference<List<CitationReference>>() {
        });

        int count = 0;
        for (CitationReference reference : references) {
            if (reference.getCitation() == null || reference.getCitation().isBlank()) {
                log.warn("Skipping registry record without citation: {}", reference);
                continue;
            }
            registry.register(reference);
            count++;
        }
        return count;
    }

    public boolean isLoaded() {
        return loaded;
    }
}
