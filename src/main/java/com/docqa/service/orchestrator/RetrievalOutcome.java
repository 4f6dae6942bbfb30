package com.docqa.service.orchestrator;

import com.docqa.dto.internal.ScoredChunk;

import java.util.List;

/**
 * Ranked chunks plus the size of the candidate pool they were drawn from.
 */
public record RetrievalOutcome(List<ScoredChunk> chunks, int numCandidates, double alpha) {

    public RetrievalOutcome {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }
}
