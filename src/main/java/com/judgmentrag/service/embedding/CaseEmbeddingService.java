package com.judgmentrag.service.embedding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import com.judgmentrag.config.EmbeddingConfig;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.EmbeddingException;
import com.judgmentrag.exception.RagException;
import com.judgmentrag.service.llm.ProviderCallGuard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Embeds segment and query text in fixed-size batches.
 * <p>
 * Output order and length always match the input. A call either embeds every text or
 * fails as a whole with {@link EmbeddingException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseEmbeddingService {

    static final String RESILIENCE_NAME = "embedding";

    private final EmbeddingConfig embeddingConfig;
    private final EmbeddingModel embeddingModel;
    private final ProviderCallGuard callGuard;

    /**
     * Query embeddings are cached; segment embeddings go through {@link #embed(List)} uncached.
     * The returned array is the cached instance and must not be modified.
     */
    @Cacheable(value = "query-embeddings", key = "#query")
    public float[] embedQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new EmbeddingException("Query text is empty");
        }
        return embed(List.of(query)).get(0);
    }

    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Collections.emptyList();
        }

        int batchSize = embeddingConfig.getBatchSize();
        List<float[]> vectors = new ArrayList<>(texts.size());

        try {
            for (int from = 0; from < texts.size(); from += batchSize) {
                List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
                log.debug("Embedding batch of {} texts", batch.size());

                List<float[]> embedded = callGuard.call(RESILIENCE_NAME, RESILIENCE_NAME,
                        () -> embeddingModel.embed(batch));
                vectors.addAll(validate(batch, embedded));
            }
        } catch (ConfigurationException | EmbeddingException e) {
            throw e;
        } catch (RagException e) {
            log.error("Embedding of {} texts failed: {}", texts.size(), e.getMessage());
            throw new EmbeddingException("Failed to generate embeddings", e);
        }

        return vectors;
    }

    public int dimension() {
        return embeddingConfig.getDimension();
    }

    private List<float[]> validate(List<String> batch, List<float[]> embedded) {
        if (embedded == null || embedded.size() != batch.size()) {
            throw new EmbeddingException(String.format(
                    "Embedding provider returned %d vectors for %d texts",
                    embedded == null ? 0 : embedded.size(), batch.size()));
        }
        int expected = embeddingConfig.getDimension();
        for (float[] vector : embedded) {
            if (vector == null || vector.length != expected) {
                throw new EmbeddingException(String.format(
                        "Embedding dimension mismatch: expected %d, got %d",
                        expected, vector == null ? 0 : vector.length));
            }
        }
        return embedded;
    }
}
