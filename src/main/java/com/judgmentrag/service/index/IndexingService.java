package com.judgmentrag.service.index;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.response.IndexingReport;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.DataValidationException;
import com.judgmentrag.exception.DimensionMismatchException;
import com.judgmentrag.exception.EmbeddingException;
import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.model.ChunkingSettings;
import com.judgmentrag.model.IndexEntry;
import com.judgmentrag.model.Segment;
import com.judgmentrag.service.data.CaseRecordValidator;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.service.data.CorpusLoadResult;
import com.judgmentrag.service.data.CorpusLoaderService;
import com.judgmentrag.service.embedding.CaseEmbeddingService;
import com.judgmentrag.util.TextSegmenter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Offline path: validate, segment, embed and store cases batch by batch.
 * <p>
 * Runs are serialized; queries keep reading the index while a run is in progress. Re-indexing a
 * case replaces its segments by id and prunes the ones its new text no longer produces, so
 * running the same corpus twice leaves the index unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingService {

    private final VectorIndex vectorIndex;
    private final CaseStore caseStore;
    private final CaseEmbeddingService embeddingService;
    private final TextSegmenter segmenter;
    private final CaseRecordValidator validator;
    private final CorpusLoaderService corpusLoader;
    private final ModelConfig modelConfig;

    private final ReentrantLock runLock = new ReentrantLock();

    public IndexingReport indexCorpus(List<CaseRecord> records, int chunkSize, int overlap, int batchSize) {
        ChunkingSettings settings = new ChunkingSettings(chunkSize, overlap);
        if (batchSize <= 0) {
            throw new ConfigurationException("batch_size must be positive, got " + batchSize);
        }

        runLock.lock();
        try {
            return run(records, settings, batchSize);
        } finally {
            runLock.unlock();
        }
    }

    public IndexingReport indexCorpus(List<CaseRecord> records) {
        return indexCorpus(records, modelConfig.getChunkSize(), modelConfig.getOverlap(), modelConfig.getBatchSize());
    }

    /**
     * Indexes raw corpus objects, reporting the ones that fail normalization.
     */
    public IndexingReport indexRaw(List<Map<String, Object>> raw, int chunkSize, int overlap, int batchSize) {
        CorpusLoadResult loaded = corpusLoader.toRecords(raw, new ArrayList<>());
        return merge(loaded.errors(), indexCorpus(loaded.records(), chunkSize, overlap, batchSize));
    }

    /**
     * Loads and indexes the configured corpus file.
     */
    public IndexingReport indexFromSource(int chunkSize, int overlap, int batchSize) {
        CorpusLoadResult loaded = corpusLoader.loadConfiguredCorpus();
        return merge(loaded.errors(), indexCorpus(loaded.records(), chunkSize, overlap, batchSize));
    }

    public IndexingReport indexFromSource() {
        return indexFromSource(modelConfig.getChunkSize(), modelConfig.getOverlap(), modelConfig.getBatchSize());
    }

    /**
     * Removes a case from the index and the case store. Returns false when it was not indexed.
     */
    public boolean removeCase(String caseId) {
        runLock.lock();
        try {
            int segments = vectorIndex.removeCase(caseId);
            boolean stored = caseStore.remove(caseId);
            if (segments > 0 || stored) {
                log.info("Removed case {} ({} segments)", caseId, segments);
                return true;
            }
            return false;
        } finally {
            runLock.unlock();
        }
    }

    private IndexingReport run(List<CaseRecord> records, ChunkingSettings settings, int batchSize) {
        long start = System.nanoTime();

        log.info("=".repeat(70));
        log.info("INDEXING {} CASES (chunk={}, overlap={}, batch={})",
                records.size(), settings.chunkSize(), settings.overlap(), batchSize);
        log.info("=".repeat(70));

        List<String> errors = new ArrayList<>();
        List<CaseRecord> accepted = accept(records, errors);

        int segmentsIndexed = 0;
        int casesIndexed = 0;

        for (int from = 0; from < accepted.size(); from += batchSize) {
            List<CaseRecord> batch = accepted.subList(from, Math.min(from + batchSize, accepted.size()));
            try {
                segmentsIndexed += indexBatch(batch, settings);
                casesIndexed += batch.size();
                log.info("Indexed cases {}-{} of {}", from + 1, from + batch.size(), accepted.size());
            } catch (EmbeddingException | DimensionMismatchException e) {
                log.error("Batch starting at case {} failed: {}", batch.get(0).caseId(), e.getMessage());
                batch.forEach(c -> errors.add(c.caseId() + ": " + e.getMessage()));
            }
        }

        vectorIndex.compact();
        caseStore.compact();

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info("Indexing finished: {} cases, {} segments, {} errors in {}s",
                casesIndexed, segmentsIndexed, errors.size(), String.format("%.2f", seconds));

        return IndexingReport.builder()
                .segmentsIndexed(segmentsIndexed)
                .casesIndexed(casesIndexed)
                .errors(errors)
                .durationSeconds(seconds)
                .build();
    }

    private List<CaseRecord> accept(List<CaseRecord> records, List<String> errors) {
        List<CaseRecord> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CaseRecord record : records) {
            try {
                CaseRecord valid = validator.validate(record);
                if (!seen.add(valid.caseId())) {
                    throw new DataValidationException(valid.caseId(), "duplicate case_id");
                }
                accepted.add(valid);
            } catch (DataValidationException e) {
                log.warn("Rejected case {}: {}", e.getCaseId(), e.getMessage());
                errors.add(e.getCaseId() + ": " + e.getMessage());
            }
        }
        return accepted;
    }

    private int indexBatch(List<CaseRecord> batch, ChunkingSettings settings) {
        List<Segment> segments = new ArrayList<>();
        for (CaseRecord c : batch) {
            segments.addAll(segmenter.segment(c, settings));
        }

        List<float[]> vectors = embeddingService.embed(segments.stream().map(Segment::text).toList());

        Map<String, CaseRecord> byId = new HashMap<>();
        batch.forEach(c -> byId.put(c.caseId(), c));

        List<IndexEntry> entries = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            entries.add(IndexEntry.of(segment, vectors.get(i), byId.get(segment.caseId()).metadata()));
        }
        vectorIndex.upsert(entries);

        for (CaseRecord c : batch) {
            Set<String> keep = new HashSet<>();
            segments.stream()
                    .filter(s -> s.caseId().equals(c.caseId()))
                    .forEach(s -> keep.add(s.segmentId()));
            int pruned = vectorIndex.pruneCase(c.caseId(), keep);
            if (pruned > 0) {
                log.debug("Pruned {} stale segments of case {}", pruned, c.caseId());
            }
        }

        caseStore.putAll(batch);
        return entries.size();
    }

    private IndexingReport merge(List<String> loadErrors, IndexingReport report) {
        if (!loadErrors.isEmpty()) {
            List<String> errors = new ArrayList<>(loadErrors);
            errors.addAll(report.getErrors());
            report.setErrors(errors);
        }
        return report;
    }
}
