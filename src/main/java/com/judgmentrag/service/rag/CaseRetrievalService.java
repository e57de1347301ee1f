package com.judgmentrag.service.rag;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.RetrievalResult;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.service.embedding.CaseEmbeddingService;
import com.judgmentrag.service.index.VectorIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a query into ranked distinct cases.
 * <p>
 * A case scores the best similarity among its retrieved segments, so a single strong passage
 * outranks several weak ones. Embedding failures propagate as
 * {@link com.judgmentrag.exception.EmbeddingException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseRetrievalService {

    static final Comparator<RetrievedCase> CASE_RANKING =
            Comparator.comparingDouble(RetrievedCase::score).reversed()
                    .thenComparing(c -> c.metadata().decisionDate(),
                            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
                    .thenComparing(RetrievedCase::caseId);

    private final CaseEmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final ModelConfig modelConfig;

    public RetrievalResult retrieve(String query, int topKCases, int segmentFanout, SearchFilters filters) {
        if (topKCases <= 0 || vectorIndex.count() == 0) {
            return RetrievalResult.empty();
        }

        int fanout = segmentFanout > topKCases
                ? segmentFanout
                : topKCases * modelConfig.getFanoutMultiplier();

        float[] queryVector = embeddingService.embedQuery(query);
        List<ScoredEntry> segments = vectorIndex.search(queryVector, fanout, filters);

        List<RetrievedCase> ranked = aggregate(segments);
        List<RetrievedCase> top = ranked.size() > topKCases ? ranked.subList(0, topKCases) : ranked;

        log.debug("Retrieved {} cases from {} segments (fanout {})", top.size(), segments.size(), fanout);
        return new RetrievalResult(top, segments.size());
    }

    public RetrievalResult retrieve(String query, int topKCases, SearchFilters filters) {
        return retrieve(query, topKCases, modelConfig.getSegmentFanout(), filters);
    }

    /**
     * Groups segments by case, keeping each case's segments in their search order.
     */
    static List<RetrievedCase> aggregate(List<ScoredEntry> segments) {
        Map<String, List<ScoredEntry>> byCase = new LinkedHashMap<>();
        for (ScoredEntry segment : segments) {
            byCase.computeIfAbsent(segment.caseId(), id -> new ArrayList<>()).add(segment);
        }

        List<RetrievedCase> cases = new ArrayList<>(byCase.size());
        byCase.forEach((caseId, supporting) -> {
            double best = supporting.stream().mapToDouble(ScoredEntry::score).max().orElse(0.0);
            cases.add(new RetrievedCase(caseId, supporting.get(0).entry().metadata(), best, supporting));
        });

        cases.sort(CASE_RANKING);
        return cases;
    }
}
