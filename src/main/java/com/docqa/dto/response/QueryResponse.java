package com.docqa.dto.response;

import com.docqa.dto.internal.Citation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String answer;

    private List<Citation> citations;

    /**
     * Diagnostics: intent, agent, counts, timing, terminal_state.
     */
    private Map<String, Object> metadata;

    /**
     * Soft-failure indicator; null when the run completed normally.
     */
    private String error;

    public boolean isDegraded() {
        return error != null;
    }
}
