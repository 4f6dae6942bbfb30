package com.docqa.exception;

/**
 * Embedding provider failure or an unusable query vector during retrieval.
 */
public class RetrievalException extends RagException {
    
    public RetrievalException(String message) {
        super(message);
    }
    
    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
