package com.judgmentrag.dto.internal;

import com.judgmentrag.model.IndexEntry;

/**
 * An index entry with its cosine similarity to the query vector.
 */
public record ScoredEntry(IndexEntry entry, double score) {

    public String segmentId() {
        return entry.segmentId();
    }

    public String caseId() {
        return entry.caseId();
    }

    public String text() {
        return entry.text();
    }
}
