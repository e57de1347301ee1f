package com.judgmentrag.exception;

import lombok.Getter;

/**
 * A single case record is malformed. The record is skipped, the batch continues.
 */
@Getter
public class DataValidationException extends RagException {

    private final String caseId;

    public DataValidationException(String caseId, String message) {
        super(message);
        this.caseId = caseId;
    }
}
