package com.judgmentrag.model;

import java.time.LocalDate;
import java.util.List;

import lombok.Builder;

/**
 * A prior judgment as stored in the corpus. Immutable once indexed.
 */
@Builder(toBuilder = true)
public record CaseRecord(
        String caseId,
        String title,
        String citation,
        String court,
        LocalDate decisionDate,
        String fullText,
        List<String> judges,
        List<String> tags
) {

    public CaseRecord {
        judges = judges == null ? List.of() : List.copyOf(judges);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public CaseMetadata metadata() {
        return new CaseMetadata(caseId, title, citation, court, decisionDate, judges, tags);
    }
}
