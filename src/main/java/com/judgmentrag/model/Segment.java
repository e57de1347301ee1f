package com.judgmentrag.model;

import java.util.Locale;

/**
 * A window of a case's text. {@code endOffset} is exclusive.
 */
public record Segment(
        String segmentId,
        String caseId,
        String text,
        int startOffset,
        int endOffset,
        int sequenceIndex
) {

    /**
     * Stable id for the segment at {@code sequenceIndex} of a case. Re-indexing relies on it.
     */
    public static String idFor(String caseId, int sequenceIndex) {
        return String.format(Locale.ROOT, "%s::%05d", caseId, sequenceIndex);
    }
}
