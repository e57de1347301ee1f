package com.judgmentrag.dto.internal;

import java.util.List;

import com.judgmentrag.model.CaseMetadata;

/**
 * One distinct case of a retrieval result. {@code score} is the best similarity among its
 * supporting segments, which are kept in rank order.
 */
public record RetrievedCase(
        String caseId,
        CaseMetadata metadata,
        double score,
        List<ScoredEntry> supportingSegments
) {

    public RetrievedCase {
        supportingSegments = List.copyOf(supportingSegments);
    }

    public String title() {
        return metadata.title();
    }

    public String citation() {
        return metadata.citation();
    }
}
