package com.docqa.config;

import com.docqa.service.routing.Intent;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline tuning: retrieval weights, reasoning context, utility output and routing keywords.
 * Every value has a default so a partial application.yml is valid.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "doc-qa")
public class ModelConfig {

    public static final int DEFAULT_TOP_K = 5;
    public static final double DEFAULT_ALPHA = 0.7;
    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B = 0.75;

    private Retrieval retrieval;
    private Reasoning reasoning;
    private Utility utility;
    private Routing routing;
    private Llm llm;

    // ============================================================
    // Retrieval Configuration
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer topK;
        private Double alpha;  // Hybrid weight (semantic vs lexical)
        private Integer maxChunksPerDocument;  // null -> ceil(topK/2)+1
        private Double k1;
        private Double b;
    }

    // ============================================================
    // Reasoning Configuration
    // ============================================================
    @Data
    public static class Reasoning {
        private Integer historyTurns;
        private Integer snippetLength;
    }

    @Data
    public static class Utility {
        private Integer summarySentences;
    }

    @Data
    public static class Routing {
        private Map<Intent, List<String>> keywords = new EnumMap<>(Intent.class);
    }

    @Data
    public static class Llm {
        private Integer timeoutSeconds;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getTopK() {
        return retrieval != null && retrieval.getTopK() != null
                ? retrieval.getTopK()
                : DEFAULT_TOP_K;
    }

    public double getAlpha() {
        return retrieval != null && retrieval.getAlpha() != null
                ? retrieval.getAlpha()
                : DEFAULT_ALPHA;
    }

    /**
     * Per-document cap for the diversity pass; the default grows with topK.
     */
    public int getMaxChunksPerDocument(int topK) {
        if (retrieval != null && retrieval.getMaxChunksPerDocument() != null) {
            return retrieval.getMaxChunksPerDocument();
        }
        return (int) Math.ceil(topK / 2.0) + 1;
    }

    public double getK1() {
        return retrieval != null && retrieval.getK1() != null
                ? retrieval.getK1()
                : DEFAULT_K1;
    }

    public double getB() {
        return retrieval != null && retrieval.getB() != null
                ? retrieval.getB()
                : DEFAULT_B;
    }

    public int getHistoryTurns() {
        return reasoning != null && reasoning.getHistoryTurns() != null
                ? reasoning.getHistoryTurns()
                : 2;
    }

    public int getSnippetLength() {
        return reasoning != null && reasoning.getSnippetLength() != null
                ? reasoning.getSnippetLength()
                : 200;
    }

    public int getSummarySentences() {
        return utility != null && utility.getSummarySentences() != null
                ? utility.getSummarySentences()
                : 5;
    }

    public Map<Intent, List<String>> getRoutingKeywords() {
        return routing != null && routing.getKeywords() != null
                ? routing.getKeywords()
                : Map.of();
    }

    public int getLlmTimeoutSeconds() {
        return llm != null && llm.getTimeoutSeconds() != null
                ? llm.getTimeoutSeconds()
                : 60;
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("PIPELINE CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  - TopK: {}", getTopK());
        log.info("  - Alpha (semantic weight): {}", getAlpha());
        log.info("  - Max chunks per document: {}", getMaxChunksPerDocument(getTopK()));
        log.info("  - BM25 k1={}, b={}", getK1(), getB());
        log.info("  - History turns: {}", getHistoryTurns());
        log.info("  - Summary sentences: {}", getSummarySentences());
        log.info("  - LLM timeout: {}s", getLlmTimeoutSeconds());
        if (!getRoutingKeywords().isEmpty()) {
            log.info("  - Routing keyword overrides: {}", getRoutingKeywords().keySet());
        }
        log.info("=".repeat(70));
    }
}
