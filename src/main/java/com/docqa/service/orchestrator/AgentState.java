package com.docqa.service.orchestrator;

import com.docqa.dto.internal.ChatTurn;
import com.docqa.dto.internal.Citation;
import com.docqa.dto.internal.ScoredChunk;
import com.docqa.service.routing.Intent;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable state of one pipeline run. Each stage returns a new copy via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class AgentState {

    String query;

    @Builder.Default
    List<ChatTurn> chatHistory = List.of();

    Intent intent;

    @Builder.Default
    List<ScoredChunk> retrievedChunks = List.of();

    int numCandidates;

    String answer;

    @Builder.Default
    List<Citation> citations = List.of();

    Double confidence;

    // free-form stage output, merged into response metadata
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    String error;

    @Builder.Default
    PipelineState stage = PipelineState.START;

    public boolean isErrored() {
        return stage == PipelineState.ERRORED;
    }
}
