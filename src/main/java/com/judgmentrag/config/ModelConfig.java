package com.judgmentrag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.model.ChunkingSettings;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Retrieval, indexing, generation and suggestion settings.
 * Corpus and index locations live in {@link DatasetConfig}.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "legal-rag")
public class ModelConfig {

    private Rag rag;
    private Indexing indexing;
    private Llm llm;
    private Suggest suggest;
    private Monitoring monitoring;

    // ============================================================
    // RAG Configuration
    // ============================================================
    @Data
    public static class Rag {
        private Retrieval retrieval;
    }

    @Data
    public static class Retrieval {
        private Integer topKCases;
        private Integer segmentFanout;
        private Integer fanoutMultiplier;
        private Integer casesAnalyzed;
    }

    // ============================================================
    // Indexing Configuration
    // ============================================================
    @Data
    public static class Indexing {
        private Integer chunkSize;
        private Integer overlap;
        private Integer batchSize;
        private Boolean indexOnStartup;
    }

    // ============================================================
    // LLM Configuration
    // ============================================================
    @Data
    public static class Llm {
        private Integer analysisMaxTokens;
        private Integer summaryMaxTokens;
        private Integer synthesisMaxTokens;
        private Double temperature;

        /**
         * Upper bound of segment text handed to one summarization prompt.
         */
        private Integer summaryContextChars;

        private Integer summaryConcurrency;
    }

    // ============================================================
    // Suggestion Configuration
    // ============================================================
    @Data
    public static class Suggest {
        private Integer maxSuggestions;
        private Integer minQueryLength;
    }

    // ============================================================
    // Monitoring Configuration
    // ============================================================
    @Data
    public static class Monitoring {
        private Boolean enabled;
        private Integer maxQueryHistory;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getTopKCases() {
        return retrieval() != null && retrieval().getTopKCases() != null
                ? retrieval().getTopKCases()
                : 5;
    }

    public int getSegmentFanout() {
        return retrieval() != null && retrieval().getSegmentFanout() != null
                ? retrieval().getSegmentFanout()
                : 30;
    }

    public int getFanoutMultiplier() {
        return retrieval() != null && retrieval().getFanoutMultiplier() != null
                ? retrieval().getFanoutMultiplier()
                : 4;
    }

    public int getCasesAnalyzed() {
        return retrieval() != null && retrieval().getCasesAnalyzed() != null
                ? retrieval().getCasesAnalyzed()
                : 3;
    }

    public int getChunkSize() {
        return indexing != null && indexing.getChunkSize() != null ? indexing.getChunkSize() : 1024;
    }

    public int getOverlap() {
        return indexing != null && indexing.getOverlap() != null ? indexing.getOverlap() : 128;
    }

    public int getBatchSize() {
        return indexing != null && indexing.getBatchSize() != null ? indexing.getBatchSize() : 50;
    }

    public boolean isIndexOnStartup() {
        return indexing != null && Boolean.TRUE.equals(indexing.getIndexOnStartup());
    }

    public ChunkingSettings getChunkingSettings() {
        return new ChunkingSettings(getChunkSize(), getOverlap());
    }

    public int getAnalysisMaxTokens() {
        return llm != null && llm.getAnalysisMaxTokens() != null ? llm.getAnalysisMaxTokens() : 500;
    }

    public int getSummaryMaxTokens() {
        return llm != null && llm.getSummaryMaxTokens() != null ? llm.getSummaryMaxTokens() : 300;
    }

    public int getSynthesisMaxTokens() {
        return llm != null && llm.getSynthesisMaxTokens() != null ? llm.getSynthesisMaxTokens() : 2000;
    }

    public double getTemperature() {
        return llm != null && llm.getTemperature() != null ? llm.getTemperature() : 0.2;
    }

    public int getSummaryContextChars() {
        return llm != null && llm.getSummaryContextChars() != null ? llm.getSummaryContextChars() : 2000;
    }

    public int getSummaryConcurrency() {
        return llm != null && llm.getSummaryConcurrency() != null ? llm.getSummaryConcurrency() : 4;
    }

    public int getMaxSuggestions() {
        return suggest != null && suggest.getMaxSuggestions() != null ? suggest.getMaxSuggestions() : 5;
    }

    public int getMinSuggestQueryLength() {
        return suggest != null && suggest.getMinQueryLength() != null ? suggest.getMinQueryLength() : 2;
    }

    public boolean isMonitoringEnabled() {
        return monitoring == null || !Boolean.FALSE.equals(monitoring.getEnabled());
    }

    public int getMaxQueryHistory() {
        return monitoring != null && monitoring.getMaxQueryHistory() != null
                ? monitoring.getMaxQueryHistory()
                : 100;
    }

    private Retrieval retrieval() {
        return rag != null ? rag.getRetrieval() : null;
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        ChunkingSettings chunking = getChunkingSettings();

        if (getTopKCases() <= 0 || getCasesAnalyzed() <= 0) {
            throw new ConfigurationException("top-k-cases and cases-analyzed must be positive");
        }
        if (getSegmentFanout() <= 0 || getFanoutMultiplier() <= 1) {
            throw new ConfigurationException("segment-fanout must be positive and fanout-multiplier above 1");
        }
        if (getBatchSize() <= 0) {
            throw new ConfigurationException("indexing batch-size must be positive");
        }

        log.info("=".repeat(70));
        log.info("MODEL CONFIGURATION INITIALIZED");
        log.info("=".repeat(70));
        log.info("  - Top-K cases      : {}", getTopKCases());
        log.info("  - Segment fanout   : {}", getSegmentFanout());
        log.info("  - Cases analyzed   : {}", getCasesAnalyzed());
        log.info("  - Chunk / overlap  : {} / {}", chunking.chunkSize(), chunking.overlap());
        log.info("  - Index batch size : {}", getBatchSize());
        log.info("  - Max tokens       : analysis={}, summary={}, synthesis={}",
                getAnalysisMaxTokens(), getSummaryMaxTokens(), getSynthesisMaxTokens());
        log.info("=".repeat(70));
    }
}
