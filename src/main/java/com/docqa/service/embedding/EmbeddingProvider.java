package com.docqa.service.embedding;

import java.util.List;

/**
 * External embedding model. Implementations raise
 * {@link com.docqa.exception.RetrievalException} on any failure, timeouts included.
 */
public interface EmbeddingProvider {

    List<Double> embed(String text);
}
