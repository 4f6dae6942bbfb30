package com.docqa.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void lowercasesAndStripsPunctuation() {
        assertThat(tokenizer.tokenize("Invoice TOTAL: $1,200!"))
                .containsExactly("invoice", "total", "1", "200");
    }

    @Test
    void splitsPersianWordsOnZeroWidthNonJoiner() {
        assertThat(tokenizer.tokenize("چک\u200Cلیست قرارداد"))
                .containsExactly("چک", "لیست", "قرارداد");
    }

    @Test
    void blankTextHasNoTokens() {
        assertThat(tokenizer.tokenize("   ")).isEmpty();
        assertThat(tokenizer.tokenize(null)).isEmpty();
    }
}
