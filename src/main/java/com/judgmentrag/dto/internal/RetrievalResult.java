package com.judgmentrag.dto.internal;

import java.util.List;

public record RetrievalResult(List<RetrievedCase> cases, int segmentsConsidered) {

    public RetrievalResult {
        cases = List.copyOf(cases);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), 0);
    }

    public boolean isEmpty() {
        return cases.isEmpty();
    }
}
