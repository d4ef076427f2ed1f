package com.verdictrag.service.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import com.verdictrag.TestFixtures;
import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.exception.RagException;
import com.verdictrag.model.CitationReference;
import com.verdictrag.service.quality.InMemoryCitationRegistry;

class CitationRegistryLoaderTest {

    private InMemoryCitationRegistry registry;
    private LegalRagProperties properties;
    private CitationRegistryLoader loader;

    @BeforeEach
    void setUp() {
        registry = new InMemoryCitationRegistry();
        properties = TestFixtures.properties();
        loader = new CitationRegistryLoader(registry, new DefaultResourceLoader(), properties);
    }

    @Test
    @DisplayName("bundled seed is loaded once")
    void loadsSeedOnce() {
        int loaded = loader.loadSeed();

        assertThat(loaded).isEqualTo(20);
        assertThat(registry.size()).isEqualTo(20);
        assertThat(loader.isLoaded()).isTrue();
        assertThat(loader.loadSeed()).isZero();
    }

    @Test
    @DisplayName("seeded citations resolve regardless of spacing")
    void normalisedLookup() {
        loader.loadSeed();

        CitationReference reference = registry.find("2019 (2)  SA 343   (SCA)").orElseThrow();

        assertThat(reference.getCourt()).isEqualTo("Supreme Court of Appeal");
        assertThat(reference.getYear()).isEqualTo(2019);
        assertThat(reference.getWeight()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("records without a citation are skipped")
    void skipsIncompleteRecords() throws Exception {
        String json = "[{\"citation\": \"Act 1 of 2000\", \"title\": \"Example Act\"}, {\"title\": \"No citation\"}]";

        int loaded = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(loaded).isEqualTo(1);
        assertThat(registry.find("Act 1 of 2000")).isPresent();
    }

    @Test
    @DisplayName("missing seed file fails loudly")
    void missingSeed() {
        properties.getRegistry().setSeedPath("classpath:citations/does-not-exist.json");

        assertThatThrownBy(loader::loadSeed)
                .isInstanceOf(RagException.class)
                .hasMessageContaining("does-not-exist.json");
    }
}
