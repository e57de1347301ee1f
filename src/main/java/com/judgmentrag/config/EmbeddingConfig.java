package com.judgmentrag.config;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.service.embedding.HashingEmbeddingModel;
import com.judgmentrag.util.LegalTextTokenizer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@Getter
public class EmbeddingConfig {

    public static final String PROVIDER_OLLAMA = "ollama";
    public static final String PROVIDER_HASHING = "hashing";

    @Value("${legal-rag.embedding.provider:ollama}")
    private String provider;

    @Value("${legal-rag.embedding.model:all-minilm}")
    private String model;

    @Value("${legal-rag.embedding.dimension:384}")
    private Integer dimension;

    @Value("${legal-rag.embedding.batch-size:32}")
    private Integer batchSize;

    @Bean
    public EmbeddingModel embeddingModel(OllamaApi ollamaApi, LegalTextTokenizer tokenizer) {
        if (dimension == null || dimension <= 0) {
            throw new ConfigurationException("legal-rag.embedding.dimension must be positive");
        }
        if (batchSize == null || batchSize <= 0) {
            throw new ConfigurationException("legal-rag.embedding.batch-size must be positive");
        }

        log.info("==============================================");
        log.info("EMBEDDING PROVIDER CONFIGURATION");
        log.info("==============================================");
        log.info("  Provider  : {}", provider);
        log.info("  Model     : {}", model);
        log.info("  Dimension : {}", dimension);
        log.info("  Batch     : {}", batchSize);
        log.info("==============================================");

        if (PROVIDER_HASHING.equalsIgnoreCase(provider)) {
            return new HashingEmbeddingModel(tokenizer, dimension);
        }
        if (!PROVIDER_OLLAMA.equalsIgnoreCase(provider)) {
            throw new ConfigurationException("Unknown embedding provider: " + provider);
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("legal-rag.embedding.model must be set for the ollama provider");
        }

        return OllamaEmbeddingModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(OllamaOptions.builder().model(model).build())
                .build();
    }
}
