package com.docqa.service.llm;

import com.docqa.dto.internal.ChatTurn;

import java.util.List;

/**
 * External text-completion service. Implementations raise
 * {@link com.docqa.exception.CompletionException} on any failure, timeouts included.
 */
public interface CompletionProvider {

    /**
     * @param prompt  the instruction for this turn
     * @param history prior conversation, oldest first; may be empty
     */
    String complete(String prompt, List<ChatTurn> history);
}
