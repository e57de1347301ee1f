package com.judgmentrag.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of a case's descriptive fields, copied onto every index entry of that case.
 */
public record CaseMetadata(
        String caseId,
        String title,
        String citation,
        String court,
        LocalDate decisionDate,
        List<String> judges,
        List<String> tags
) {

    public CaseMetadata {
        judges = judges == null ? List.of() : List.copyOf(judges);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
