package com.docqa.service.reasoning;

import com.docqa.config.ModelConfig;
import com.docqa.dto.internal.ChatTurn;
import com.docqa.dto.internal.Citation;
import com.docqa.dto.internal.ScoredChunk;
import com.docqa.exception.CompletionException;
import com.docqa.service.llm.CompletionProvider;
import com.docqa.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grounded answer generation over retrieved chunks, with citation extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReasoningStage {

    private static final Pattern SOURCE_MARKER = Pattern.compile("\\[Source (\\d+)\\]");

    private static final List<String> UNCERTAINTY_MARKERS = List.of(
            "not sure", "unclear", "cannot determine", "can't determine",
            "not enough information", "does not contain", "doesn't contain",
            "مطمئن نیستم", "نامشخص", "اطلاعات کافی"
    );

    private final CompletionProvider completionProvider;
    private final PromptBuilder promptBuilder;
    private final ModelConfig modelConfig;

    public ReasoningResult reason(String query, List<ScoredChunk> chunks, List<ChatTurn> chatHistory) {
        if (chunks == null || chunks.isEmpty()) {
            log.info("No retrieved chunks, answering without completion call");
            return new ReasoningResult(PromptBuilder.NO_CONTEXT_ANSWER, List.of(), 0.0, null);
        }

        String context = promptBuilder.formatContext(chunks);
        String prompt = promptBuilder.buildGroundedAnswerPrompt(query, context);
        List<ChatTurn> history = recentHistory(chatHistory);

        String answer;
        try {
            answer = completionProvider.complete(prompt, history).trim();
        } catch (CompletionException e) {
            log.error("Answer generation failed: {}", e.getMessage(), e);
            return new ReasoningResult(PromptBuilder.APOLOGY_ANSWER, List.of(), 0.0, e.getMessage());
        }

        List<Citation> citations = extractCitations(answer, chunks);
        double confidence = estimateConfidence(answer, chunks);

        log.info("Generated answer with {} citations (confidence {})", citations.size(),
                String.format(Locale.ROOT, "%.2f", confidence));
        return new ReasoningResult(answer, citations, confidence, null);
    }

    /**
     * Last N exchanges, oldest first.
     */
    List<ChatTurn> recentHistory(List<ChatTurn> chatHistory) {
        if (chatHistory == null || chatHistory.isEmpty()) {
            return List.of();
        }
        int keep = modelConfig.getHistoryTurns() * 2;
        int from = Math.max(0, chatHistory.size() - keep);
        return List.copyOf(chatHistory.subList(from, chatHistory.size()));
    }

    /**
     * One citation per distinct [Source n] marker in order of first reference.
     * An answer without a valid marker cites every chunk.
     */
    List<Citation> extractCitations(String answer, List<ScoredChunk> chunks) {
        Set<Integer> referenced = new LinkedHashSet<>();
        Matcher matcher = SOURCE_MARKER.matcher(answer);
        while (matcher.find()) {
            int index;
            try {
                index = Integer.parseInt(matcher.group(1)) - 1;
            } catch (NumberFormatException e) {
                continue;
            }
            if (index >= 0 && index < chunks.size()) {
                referenced.add(index);
            }
        }

        List<Citation> citations = new ArrayList<>();
        if (referenced.isEmpty()) {
            for (ScoredChunk chunk : chunks) {
                citations.add(toCitation(chunk));
            }
        } else {
            for (Integer index : referenced) {
                citations.add(toCitation(chunks.get(index)));
            }
        }
        return citations;
    }

    private Citation toCitation(ScoredChunk chunk) {
        return Citation.builder()
                .documentId(chunk.getDocumentId())
                .documentTitle(chunk.getDocumentTitle())
                .pageNumber(chunk.getPageNumber())
                .sequenceIndex(chunk.getSequenceIndex())
                .snippet(snippet(chunk.getText()))
                .build();
    }

    private String snippet(String text) {
        int length = modelConfig.getSnippetLength();
        if (text.length() <= length) {
            return text;
        }
        return text.substring(0, length) + "...";
    }

    double estimateConfidence(String answer, List<ScoredChunk> chunks) {
        double confidence = 0.5;
        confidence += Math.min(chunks.size() * 0.1, 0.3);

        double meanScore = chunks.stream()
                .mapToDouble(ScoredChunk::getCombinedScore)
                .average()
                .orElse(0.0);
        confidence += meanScore * 0.2;

        String lower = answer.toLowerCase(Locale.ROOT);
        for (String marker : UNCERTAINTY_MARKERS) {
            if (lower.contains(marker)) {
                confidence *= 0.7;
                break;
            }
        }

        return Math.min(confidence, 1.0);
    }
}
