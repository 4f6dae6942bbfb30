package com.docqa.service.reasoning;

import com.docqa.dto.internal.Citation;

import java.util.List;

/**
 * Outcome of the reasoning stage. {@code error} is null on success.
 */
public record ReasoningResult(String answer, List<Citation> citations, double confidence, String error) {

    public ReasoningResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean failed() {
        return error != null;
    }
}
