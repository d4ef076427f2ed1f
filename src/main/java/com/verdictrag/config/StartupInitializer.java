package com.verdictrag.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.verdictrag.service.data.CitationRegistryLoader;
import com.verdictrag.service.index.IndexSnapshotStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final CitationRegistryLoader registryLoader;
    private final IndexSnapshotStore snapshotStore;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING LEGAL RAG PIPELINE");
        log.info("{}\n", "=".repeat(70));

        try {
            registryLoader.loadSeed();

            if (snapshotStore.load()) {
                log.info("Index restored from snapshot");
            }

            log.info("\n{}", "=".repeat(70));
            log.info("PIPELINE READY");
            log.info("{}\n", "=".repeat(70));

        } catch (Exception e) {
            log.error("\n{}", "=".repeat(70));
            log.error("INITIALIZATION FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started but citation validation or the restored index may be incomplete");
        }
    }
}
