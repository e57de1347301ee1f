package com.judgmentrag.service.data;

import java.util.List;

import com.judgmentrag.model.CaseRecord;

/**
 * Records accepted from a corpus file, and one message per rejected record.
 */
public record CorpusLoadResult(List<CaseRecord> records, List<String> errors) {

    public CorpusLoadResult {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }
}
