package com.judgmentrag.model;

/**
 * The persisted unit of the vector index. The vector array is never mutated after creation.
 */
public record IndexEntry(
        String segmentId,
        String caseId,
        int sequenceIndex,
        int startOffset,
        int endOffset,
        String text,
        float[] vector,
        CaseMetadata metadata
) {

    public static IndexEntry of(Segment segment, float[] vector, CaseMetadata metadata) {
        return new IndexEntry(
                segment.segmentId(),
                segment.caseId(),
                segment.sequenceIndex(),
                segment.startOffset(),
                segment.endOffset(),
                segment.text(),
                vector.clone(),
                metadata
        );
    }

    public int dimension() {
        return vector.length;
    }
}
