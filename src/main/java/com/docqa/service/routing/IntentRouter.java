package com.docqa.service.routing;

import com.docqa.config.ModelConfig;
import com.docqa.util.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rule-based intent classification. Rules are checked in table order
 * (most specific utility first) and the first keyword hit wins; anything
 * else is a question for the retrieval path.
 */
@Slf4j
@Component
public class IntentRouter {

    /**
     * English and Persian keywords, in priority order.
     */
    public static final List<IntentRule> DEFAULT_RULES = List.of(
            new IntentRule(Intent.CHECKLIST, List.of(
                    "checklist", "check list", "todo list", "action items",
                    "چک\u200Cلیست", "چک لیست", "فهرست کارها")),
            new IntentRule(Intent.TRANSLATE, List.of(
                    "translate", "translation",
                    "ترجمه", "به انگلیسی", "به فارسی")),
            new IntentRule(Intent.SUMMARIZE, List.of(
                    "summarize", "summarise", "summary", "tl;dr",
                    "خلاصه", "خلاصه کن", "خلاصه\u200Cاش کن"))
    );

    private final Tokenizer tokenizer;
    private final List<IntentRule> rules;

    public IntentRouter(Tokenizer tokenizer, ModelConfig modelConfig) {
        this.tokenizer = tokenizer;
        this.rules = buildRules(modelConfig.getRoutingKeywords());
    }

    public Intent classify(String query) {
        if (query == null || query.isBlank()) {
            return Intent.RAG_QUERY;
        }

        String normalized = " " + tokenizer.normalize(query) + " ";

        for (IntentRule rule : rules) {
            for (String keyword : rule.keywords()) {
                String needle = tokenizer.normalize(keyword);
                if (!needle.isEmpty() && normalized.contains(" " + needle + " ")) {
                    log.debug("Query matched '{}' -> {}", keyword, rule.intent());
                    return rule.intent();
                }
            }
        }

        return Intent.RAG_QUERY;
    }

    public List<IntentRule> getRules() {
        return rules;
    }

    /**
     * Configured keyword lists replace the defaults of their intent; priority order is fixed.
     */
    private static List<IntentRule> buildRules(Map<Intent, List<String>> overrides) {
        List<IntentRule> table = new ArrayList<>();
        for (IntentRule rule : DEFAULT_RULES) {
            List<String> configured = overrides.get(rule.intent());
            table.add(configured != null && !configured.isEmpty()
                    ? new IntentRule(rule.intent(), configured)
                    : rule);
        }
        return List.copyOf(table);
    }
}
