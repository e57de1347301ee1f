package com.judgmentrag.exception;

/**
 * Raised when an embedding call fails as a whole. Partial batches are never returned.
 */
public class EmbeddingException extends RagException {
    
    public EmbeddingException(String message) {
        super(message);
    }
    
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
