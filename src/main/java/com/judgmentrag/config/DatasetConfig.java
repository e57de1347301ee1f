package com.judgmentrag.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * Corpus source and persisted index location.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "legal-rag.dataset")
public class DatasetConfig {

    /**
     * Corpus file, JSON array or JSON lines
     */
    private String corpus;

    /**
     * Directory holding the segment and case journals
     */
    private String indexDir = "vectorstore";

    public Path getIndexPath() {
        return Path.of(indexDir).toAbsolutePath();
    }

    public Path getCorpusPath() {
        return corpus != null ? Path.of(corpus).toAbsolutePath() : null;
    }
}
