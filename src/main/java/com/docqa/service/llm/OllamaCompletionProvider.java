package com.docqa.service.llm;

import com.docqa.dto.internal.ChatTurn;
import com.docqa.exception.CompletionException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OllamaCompletionProvider implements CompletionProvider {
    
    private final ChatModel chatModel;
    
    /**
     * Generate a completion, replaying the given history as prior chat messages
     */
    @Override
    @CircuitBreaker(name = "completion", fallbackMethod = "fallbackComplete")
    @Retry(name = "completion")
    public String complete(String prompt, List<ChatTurn> history) {
        try {
            log.debug("Generating completion ({} history messages)", history.size());
            
            List<Message> messages = new ArrayList<>();
            for (ChatTurn turn : history) {
                messages.add(turn.isAssistant()
                        ? new AssistantMessage(turn.getContent())
                        : new UserMessage(turn.getContent()));
            }
            messages.add(new UserMessage(prompt));
            
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response == null || response.getResult() == null) {
                throw new CompletionException("Empty response from completion service");
            }

            String content = response.getResult().getOutput().getText();
            if (content == null) {
                throw new CompletionException("Completion service returned no text");
            }

            log.debug("Completion generated successfully");
            return content;
            
        } catch (CompletionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error generating completion: {}", e.getMessage());
            throw new CompletionException("Failed to generate completion", e);
        }
    }
    
    /**
     * Open-circuit path: report the failure rather than a canned answer
     */
    private String fallbackComplete(String prompt, List<ChatTurn> history, Throwable e) {
        log.warn("Completion unavailable: {}", e.getMessage());
        if (e instanceof CompletionException) {
            throw (CompletionException) e;
        }
        throw new CompletionException("Completion service unavailable", e);
    }
}
