package com.judgmentrag.dto.internal;

/**
 * Key arguments of one retrieved case. {@code rank} is the case's position in the retrieval result.
 */
public record CaseSummary(int rank, String caseId, String title, String citation, String summary) {
}
