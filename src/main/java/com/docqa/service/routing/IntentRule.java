package com.docqa.service.routing;

import java.util.List;

/**
 * One row of the routing table: an intent and the keywords that select it.
 */
public record IntentRule(Intent intent, List<String> keywords) {

    public IntentRule {
        keywords = List.copyOf(keywords);
    }
}
