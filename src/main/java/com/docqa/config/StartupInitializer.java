package com.docqa.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.docqa.service.data.JsonChunkSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final JsonChunkSource jsonChunkSource;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING DOCUMENT Q&A PIPELINE");
        log.info("{}\n", "=".repeat(70));

        try {
            jsonChunkSource.reload();

            log.info("Corpus: {}", jsonChunkSource.getStatistics());
            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY");
            log.info("{}\n", "=".repeat(70));

        } catch (Exception e) {
            log.error("\n{}", "=".repeat(70));
            log.error("INITIALIZATION FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started with an empty corpus; questions will get the no-content answer");
        }
    }
}
