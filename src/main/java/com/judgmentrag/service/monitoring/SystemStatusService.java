package com.judgmentrag.service.monitoring;

import java.time.Duration;
import java.time.Instant;

import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.judgmentrag.config.EmbeddingConfig;
import com.judgmentrag.dto.response.StatusResponse;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.service.index.VectorIndex;

import lombok.extern.slf4j.Slf4j;

/**
 * Index size and provider reachability. The Ollama probe result is reused for a short while so
 * that status polling does not hit the provider on every call.
 */
@Slf4j
@Service
public class SystemStatusService {

    private static final Duration PROBE_TTL = Duration.ofSeconds(30);

    private final VectorIndex vectorIndex;
    private final CaseStore caseStore;
    private final OllamaApi ollamaApi;
    private final EmbeddingConfig embeddingConfig;
    private final String chatModel;

    private volatile Instant lastProbe = Instant.EPOCH;
    private volatile boolean lastReachable;

    public SystemStatusService(VectorIndex vectorIndex,
                               CaseStore caseStore,
                               OllamaApi ollamaApi,
                               EmbeddingConfig embeddingConfig,
                               @Value("${spring.ai.ollama.chat.options.model:}") String chatModel) {
        this.vectorIndex = vectorIndex;
        this.caseStore = caseStore;
        this.ollamaApi = ollamaApi;
        this.embeddingConfig = embeddingConfig;
        this.chatModel = chatModel;
    }

    public StatusResponse getStatus() {
        int segments = vectorIndex.count();
        boolean reachable = providersReachable();

        return StatusResponse.builder()
                .indexedSegmentCount(segments)
                .indexedCaseCount(caseStore.count())
                .providersReachable(reachable)
                .ready(segments > 0 && reachable)
                .chatModel(chatModel)
                .embeddingProvider(embeddingConfig.getProvider())
                .build();
    }

    public boolean providersReachable() {
        Instant now = Instant.now();
        if (Duration.between(lastProbe, now).compareTo(PROBE_TTL) < 0) {
            return lastReachable;
        }

        boolean reachable;
        try {
            ollamaApi.listModels();
            reachable = true;
        } catch (Exception e) {
            log.warn("Ollama is not reachable: {}", e.getMessage());
            reachable = false;
        }

        lastReachable = reachable;
        lastProbe = now;
        return reachable;
    }
}
