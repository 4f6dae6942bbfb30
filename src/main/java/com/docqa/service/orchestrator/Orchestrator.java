package com.docqa.service.orchestrator;

import com.docqa.config.ModelConfig;
import com.docqa.dto.internal.ChatTurn;
import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ChunkFilter;
import com.docqa.dto.internal.DocumentRef;
import com.docqa.dto.internal.ScoredChunk;
import com.docqa.dto.response.QueryResponse;
import com.docqa.dto.response.UtilityResponse;
import com.docqa.exception.DocumentNotFoundException;
import com.docqa.exception.InvalidArgumentException;
import com.docqa.exception.RetrievalException;
import com.docqa.exception.UtilityException;
import com.docqa.service.data.ChunkSource;
import com.docqa.service.monitoring.StageTimer;
import com.docqa.service.rag.HybridRetriever;
import com.docqa.service.reasoning.ReasoningResult;
import com.docqa.service.reasoning.ReasoningStage;
import com.docqa.service.routing.Intent;
import com.docqa.service.routing.IntentRouter;
import com.docqa.service.routing.TranslationTargetResolver;
import com.docqa.service.utility.UtilityAction;
import com.docqa.service.utility.UtilityResult;
import com.docqa.service.utility.UtilityStage;
import com.docqa.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point of the pipeline.
 *
 * <p>Chat requests run {@code START -> ROUTE -> RETRIEVE -> REASON -> DONE}, or
 * {@code START -> ROUTE -> UTILITY -> DONE} when the message asks for a transformation.
 * Document utilities skip routing: {@code START -> UTILITY -> DONE}.
 * Recoverable stage failures end in {@code ERRORED} with a fallback answer; anything
 * else propagates.
 *
 * <p>Stateless: every call works on its own {@link AgentState}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Orchestrator {

    public static final String UTILITY_FAILURE_ANSWER =
            "I'm sorry, I couldn't complete that request right now. Please try again later.";

    private static final String AGENT_RAG = "rag";
    private static final String AGENT_UTILITY = "utility";

    private final IntentRouter intentRouter;
    private final HybridRetriever hybridRetriever;
    private final ReasoningStage reasoningStage;
    private final UtilityStage utilityStage;
    private final TranslationTargetResolver translationTargetResolver;
    private final ChunkSource chunkSource;
    private final ModelConfig modelConfig;

    /* =========================================================
     * CHAT PATH
     * ========================================================= */

    /**
     * Answers a chat message. Soft failures come back as a response with
     * {@code error} set and {@code metadata.terminal_state = ERRORED}.
     *
     * @throws InvalidArgumentException when the query is blank
     */
    public QueryResponse answerQuery(String query, List<ChatTurn> chatHistory) {
        if (query == null || query.isBlank()) {
            throw new InvalidArgumentException("Query must not be empty");
        }

        StageTimer timer = StageTimer.started();
        AgentState state = AgentState.builder()
                .query(query.trim())
                .chatHistory(chatHistory != null ? List.copyOf(chatHistory) : List.of())
                .build();

        log.info("Processing query: {}", abbreviate(state.getQuery()));

        state = route(state);
        timer.mark("Routing");

        if (state.getIntent().isUtility()) {
            state = transformMessage(state);
            timer.mark("Utility");
        } else {
            state = retrieve(state);
            timer.mark("Retrieval");

            if (!state.isErrored()) {
                state = reason(state);
                timer.mark("Reasoning");
            }
        }

        if (!state.isErrored()) {
            state = transition(state, PipelineState.DONE);
        }
        timer.end();

        log.info("Query finished in {}s with state {}", timer.getTotalTime(), state.getStage());
        return toQueryResponse(state, timer);
    }

    private AgentState route(AgentState state) {
        state = transition(state, PipelineState.ROUTE);
        Intent intent = intentRouter.classify(state.getQuery());
        log.info("Routed to {}", intent);
        return state.toBuilder().intent(intent).build();
    }

    private AgentState retrieve(AgentState state) {
        state = transition(state, PipelineState.RETRIEVE);

        RetrievalOutcome outcome;
        try {
            List<Chunk> candidates = chunkSource.listReadyChunks(ChunkFilter.all());
            double alpha = modelConfig.getAlpha();
            List<ScoredChunk> ranked = hybridRetriever.retrieve(
                    state.getQuery(), candidates, modelConfig.getTopK(), alpha);
            outcome = new RetrievalOutcome(ranked, candidates.size(), alpha);
        } catch (RetrievalException e) {
            log.error("Retrieval failed: {}", e.getMessage(), e);
            return fail(state, PromptBuilder.RETRIEVAL_FAILURE_ANSWER, e.getMessage());
        }

        return state.toBuilder()
                .retrievedChunks(outcome.chunks())
                .numCandidates(outcome.numCandidates())
                .metadata(merge(state.getMetadata(), Map.of("alpha", outcome.alpha())))
                .build();
    }

    private AgentState reason(AgentState state) {
        state = transition(state, PipelineState.REASON);

        ReasoningResult result = reasoningStage.reason(
                state.getQuery(), state.getRetrievedChunks(), state.getChatHistory());

        if (result.failed()) {
            return fail(state, result.answer(), result.error());
        }

        return state.toBuilder()
                .answer(result.answer())
                .citations(result.citations())
                .confidence(result.confidence())
                .build();
    }

    /**
     * Utility intent typed as a chat message: the message text itself is transformed.
     */
    private AgentState transformMessage(AgentState state) {
        state = transition(state, PipelineState.UTILITY);

        UtilityAction action = UtilityAction.fromIntent(state.getIntent());
        String targetLanguage = action == UtilityAction.TRANSLATE
                ? translationTargetResolver.resolve(state.getQuery())
                : null;

        UtilityResult result;
        try {
            result = UtilityResult.success(action,
                    utilityStage.execute(action, state.getQuery(), targetLanguage));
        } catch (UtilityException e) {
            result = UtilityResult.failure(action, e.getMessage());
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("utility_function", action.functionName());
        if (targetLanguage != null) {
            extra.put("target_language", targetLanguage);
        }
        state = state.toBuilder().metadata(merge(state.getMetadata(), extra)).build();

        if (result.failed()) {
            log.warn("Chat utility {} failed: {}", action.functionName(), result.error());
            return fail(state, UTILITY_FAILURE_ANSWER, result.error());
        }
        return state.toBuilder().answer(result.outputText()).build();
    }

    /* =========================================================
     * DOCUMENT UTILITY PATH
     * ========================================================= */

    /**
     * Runs a transformation over the full text of one ready document.
     *
     * @param targetLanguage required for {@code translate}, ignored otherwise
     * @throws DocumentNotFoundException when the document is unknown or not ready
     * @throws InvalidArgumentException  for an unknown action, a missing target language or an empty document
     * @throws UtilityException          when the completion fails
     */
    public UtilityResponse runUtility(String documentId, String action, String targetLanguage) {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidArgumentException("Document id is required");
        }
        UtilityAction utilityAction = UtilityAction.parse(action);

        StageTimer timer = StageTimer.started();
        AgentState state = AgentState.builder()
                .intent(utilityAction.toIntent())
                .build();

        DocumentRef document = chunkSource.findDocument(documentId)
                .filter(DocumentRef::isReady)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        String fullText = chunkSource.listReadyChunks(ChunkFilter.forDocument(documentId)).stream()
                .map(Chunk::getText)
                .filter(text -> text != null && !text.isBlank())
                .map(String::trim)
                .collect(Collectors.joining("\n\n"));
        timer.mark("Document Loading");

        log.info("Running {} on document {} ({} characters)",
                utilityAction.functionName(), documentId, fullText.length());

        state = transition(state, PipelineState.UTILITY);
        String output = utilityStage.execute(utilityAction, fullText, targetLanguage);
        state = transition(state.toBuilder().answer(output).build(), PipelineState.DONE);
        timer.mark("Utility");
        timer.end();

        Map<String, Object> metadata = baseMetadata(state, AGENT_UTILITY, timer);
        metadata.put("utility_function", utilityAction.functionName());
        metadata.put("document_id", document.getId());
        metadata.put("document_title", document.getTitle());
        if (utilityAction == UtilityAction.TRANSLATE) {
            metadata.put("target_language", targetLanguage.trim());
        }

        return UtilityResponse.builder()
                .outputText(state.getAnswer())
                .metadata(metadata)
                .build();
    }

    /* =========================================================
     * STATE HELPERS
     * ========================================================= */

    private AgentState transition(AgentState state, PipelineState next) {
        log.debug("{} -> {}", state.getStage(), next);
        return state.toBuilder().stage(next).build();
    }

    private AgentState fail(AgentState state, String fallbackAnswer, String error) {
        log.warn("{} stage failed, returning fallback answer", state.getStage());
        return transition(state, PipelineState.ERRORED).toBuilder()
                .answer(fallbackAnswer)
                .citations(List.of())
                .error(error != null ? error : "unknown error")
                .build();
    }

    private QueryResponse toQueryResponse(AgentState state, StageTimer timer) {
        Map<String, Object> metadata = baseMetadata(state,
                state.getIntent() != null && state.getIntent().isUtility() ? AGENT_UTILITY : AGENT_RAG,
                timer);
        metadata.put("num_candidates", state.getNumCandidates());
        metadata.put("num_retrieved", state.getRetrievedChunks().size());
        if (state.getConfidence() != null) {
            metadata.put("confidence", state.getConfidence());
        }

        return QueryResponse.builder()
                .answer(state.getAnswer())
                .citations(state.getCitations())
                .metadata(metadata)
                .error(state.getError())
                .build();
    }

    private Map<String, Object> baseMetadata(AgentState state, String agent, StageTimer timer) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", state.getIntent() != null ? state.getIntent().name() : null);
        metadata.put("agent", agent);
        metadata.putAll(state.getMetadata());
        metadata.put("timing", timer.toMap());
        metadata.put("terminal_state", state.getStage().name());
        return metadata;
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>(base);
        merged.putAll(extra);
        return Map.copyOf(merged);
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
