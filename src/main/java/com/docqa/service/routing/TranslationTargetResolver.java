package com.docqa.service.routing;

import com.docqa.util.Tokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the target language for a translation typed as a chat message.
 * An explicitly named language wins; otherwise Persian text goes to English
 * and everything else goes to Persian.
 */
@Component
@RequiredArgsConstructor
public class TranslationTargetResolver {

    public static final String ENGLISH = "English";
    public static final String PERSIAN = "Persian";

    private static final Map<String, String> LANGUAGES = new LinkedHashMap<>();

    static {
        LANGUAGES.put("english", ENGLISH);
        LANGUAGES.put("persian", PERSIAN);
        LANGUAGES.put("farsi", PERSIAN);
        LANGUAGES.put("spanish", "Spanish");
        LANGUAGES.put("french", "French");
        LANGUAGES.put("german", "German");
        LANGUAGES.put("arabic", "Arabic");
        LANGUAGES.put("انگلیسی", ENGLISH);
        LANGUAGES.put("فارسی", PERSIAN);
    }

    private static final Pattern NAMED_TARGET = Pattern.compile("(?:\\bto|\\binto|\\bin|به)\\s+(\\S+)");
    private static final Pattern ARABIC_SCRIPT = Pattern.compile("\\p{InArabic}");

    private final Tokenizer tokenizer;

    public String resolve(String message) {
        String normalized = tokenizer.normalize(message);

        Matcher matcher = NAMED_TARGET.matcher(normalized);
        while (matcher.find()) {
            String language = LANGUAGES.get(matcher.group(1));
            if (language != null) {
                return language;
            }
        }

        return ARABIC_SCRIPT.matcher(message).find() ? ENGLISH : PERSIAN;
    }
}
