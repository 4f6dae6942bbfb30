package com.docqa.service.utility;

import com.docqa.config.ModelConfig;
import com.docqa.exception.CompletionException;
import com.docqa.exception.InvalidArgumentException;
import com.docqa.exception.UtilityException;
import com.docqa.service.llm.CompletionProvider;
import com.docqa.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Whole-document transformations: summary, translation and checklist extraction.
 * Works on the full text it is given and never touches retrieval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UtilityStage {

    private final CompletionProvider completionProvider;
    private final PromptBuilder promptBuilder;
    private final ModelConfig modelConfig;

    /**
     * @throws InvalidArgumentException for a null action, blank text, or a translation without target
     * @throws UtilityException         when the completion fails or comes back empty
     */
    public String execute(UtilityAction action, String fullText, String targetLanguage) {
        if (action == null) {
            throw new InvalidArgumentException("Utility action is required");
        }
        if (fullText == null || fullText.isBlank()) {
            throw new InvalidArgumentException("No text to " + action.functionName());
        }
        if (action == UtilityAction.TRANSLATE && (targetLanguage == null || targetLanguage.isBlank())) {
            throw new InvalidArgumentException("Target language is required for translation");
        }

        String prompt = buildPrompt(action, fullText, targetLanguage);

        log.info("Running {} over {} characters", action.functionName(), fullText.length());

        String output;
        try {
            output = completionProvider.complete(prompt, List.of());
        } catch (CompletionException e) {
            log.error("{} failed: {}", action.functionName(), e.getMessage(), e);
            throw new UtilityException("Failed to " + action.functionName() + " the document", e);
        }

        if (output == null || output.isBlank()) {
            throw new UtilityException("Empty " + action.functionName() + " output");
        }
        return output.trim();
    }

    private String buildPrompt(UtilityAction action, String fullText, String targetLanguage) {
        if (action == UtilityAction.TRANSLATE) {
            return promptBuilder.buildTranslationPrompt(fullText, targetLanguage.trim());
        }
        if (action == UtilityAction.CHECKLIST) {
            return promptBuilder.buildChecklistPrompt(fullText);
        }
        return promptBuilder.buildSummaryPrompt(fullText, modelConfig.getSummarySentences());
    }
}
