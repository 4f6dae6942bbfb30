package com.docqa.service.routing;

import com.docqa.util.Tokenizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranslationTargetResolverTest {

    private final TranslationTargetResolver resolver = new TranslationTargetResolver(new Tokenizer());

    @Test
    void explicitLanguageWins() {
        assertThat(resolver.resolve("Translate this to French please")).isEqualTo("French");
        assertThat(resolver.resolve("translate into English: سلام دنیا")).isEqualTo("English");
        assertThat(resolver.resolve("Translate in Farsi: good morning")).isEqualTo("Persian");
    }

    @Test
    void persianDirectionPhrase() {
        assertThat(resolver.resolve("این متن را به انگلیسی ترجمه کن")).isEqualTo("English");
    }

    @Test
    void fallsBackOnScript() {
        assertThat(resolver.resolve("Translate: the goods ship on Monday")).isEqualTo("Persian");
        assertThat(resolver.resolve("ترجمه کن: کالا دوشنبه ارسال می‌شود")).isEqualTo("English");
    }

    @Test
    void unknownWordAfterPrepositionIsIgnored() {
        assertThat(resolver.resolve("Translate the memo in the folder")).isEqualTo("Persian");
    }
}
