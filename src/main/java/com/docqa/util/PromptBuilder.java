package com.docqa.util;

import java.util.List;

import org.springframework.stereotype.Component;

import com.docqa.dto.internal.ScoredChunk;

@Component
public class PromptBuilder {

    public static final String NO_CONTEXT_ANSWER =
            "I couldn't find relevant information in the uploaded documents to answer your question. "
                    + "Could you please rephrase or ask something else?";

    public static final String APOLOGY_ANSWER =
            "I'm sorry, I encountered an error while generating the answer. Please try again later.";

    public static final String RETRIEVAL_FAILURE_ANSWER =
            "I'm sorry, searching the documents failed right now. Please try again later.";

    /* =========================================================
     * GROUNDED ANSWER PROMPT
     * ========================================================= */
    public String buildGroundedAnswerPrompt(String question, String context) {

        StringBuilder prompt = new StringBuilder();

        prompt.append("You are a helpful assistant that answers questions based strictly ")
              .append("on the provided document context.\n\n");

        prompt.append("### CONTEXT FROM DOCUMENTS\n");
        prompt.append(context).append("\n\n");

        prompt.append("### QUESTION\n");
        prompt.append(question).append("\n\n");

        prompt.append("### INSTRUCTIONS\n");
        prompt.append("1. Answer ONLY with information found in the context above\n");
        prompt.append("2. If the context does not contain enough information, say so explicitly\n");
        prompt.append("3. Mark every claim with the source it comes from, e.g. [Source 2]\n");
        prompt.append("4. Be clear, concise and direct\n\n");

        prompt.append("### ANSWER");

        return prompt.toString();
    }

    /* =========================================================
     * CONTEXT FORMAT
     * ========================================================= */
    public String formatContext(List<ScoredChunk> chunks) {

        StringBuilder context = new StringBuilder();

        for (int i = 0; i < chunks.size(); i++) {
            ScoredChunk chunk = chunks.get(i);

            context.append("[Source ").append(i + 1).append(": ")
                   .append(chunk.getDocumentTitle() != null ? chunk.getDocumentTitle() : chunk.getDocumentId())
                   .append(", Page ")
                   .append(chunk.getPageNumber() != null ? chunk.getPageNumber() : "N/A")
                   .append("]\n");
            context.append(chunk.getText()).append("\n");

            if (i < chunks.size() - 1) {
                context.append("-".repeat(60)).append("\n");
            }
        }

        return context.toString();
    }

    /* =========================================================
     * UTILITY PROMPTS
     * ========================================================= */
    public String buildSummaryPrompt(String text, int sentences) {
        return """
                Summarize the following document text in at most %d sentences.
                Capture the main points and key information, in the same language as the original text.

                ### TEXT
                %s

                ### SUMMARY
                """.formatted(sentences, text);
    }

    public String buildTranslationPrompt(String text, String targetLanguage) {
        return """
                Translate the following text to %s.
                Preserve the original meaning, tone and formatting. Reply with the translation only.

                ### TEXT
                %s

                ### TRANSLATION
                """.formatted(targetLanguage, text);
    }

    public String buildChecklistPrompt(String text) {
        return """
                Extract the action items from the following document text as a structured checklist.
                Format every item on its own line as:
                - [ ] Action item description

                ### TEXT
                %s

                ### CHECKLIST
                """.formatted(text);
    }
}
