package com.docqa.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurn {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;

    private String content;

    public static ChatTurn user(String content) {
        return new ChatTurn(USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ASSISTANT, content);
    }

    public boolean isAssistant() {
        return ASSISTANT.equalsIgnoreCase(role);
    }
}
