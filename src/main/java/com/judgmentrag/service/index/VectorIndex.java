package com.judgmentrag.service.index;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.model.IndexEntry;

/**
 * Nearest-neighbour store of segment vectors with their text and case metadata.
 * <p>
 * All vectors in one index share a single dimension; a vector of another dimension,
 * stored or searched, is rejected with
 * {@link com.judgmentrag.exception.DimensionMismatchException}.
 */
public interface VectorIndex {

    /**
     * Adds or replaces entries by segment id. Each entry becomes visible whole; when this
     * method returns the entries are durable.
     */
    void upsert(Collection<IndexEntry> entries);

    /**
     * Entries passing {@code filters}, ranked by descending cosine similarity with ties
     * broken by ascending segment id. Filtering happens before the {@code topK} cut.
     */
    List<ScoredEntry> search(float[] queryVector, int topK, SearchFilters filters);

    Optional<IndexEntry> get(String segmentId);

    int count();

    int caseCount();

    /**
     * Removes every segment of the case. Returns the number removed.
     */
    int removeCase(String caseId);

    /**
     * Removes the case's segments whose ids are not in {@code keepSegmentIds}.
     */
    int pruneCase(String caseId, Collection<String> keepSegmentIds);

    List<IndexEntry> entries();

    void clear();

    /**
     * Rewrites persisted state to the live entries only.
     */
    void compact();
}
