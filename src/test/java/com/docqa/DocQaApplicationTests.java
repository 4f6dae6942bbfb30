package com.docqa;

import com.docqa.dto.internal.ChunkFilter;
import com.docqa.dto.response.QueryResponse;
import com.docqa.dto.response.UtilityResponse;
import com.docqa.exception.DocumentNotFoundException;
import com.docqa.service.data.JsonChunkSource;
import com.docqa.service.embedding.EmbeddingProvider;
import com.docqa.service.llm.CompletionProvider;
import com.docqa.service.orchestrator.Orchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "doc-qa.dataset.chunks=src/test/resources/fixtures/chunks.json")
class DocQaApplicationTests {

    @MockitoBean
    private EmbeddingProvider embeddingProvider;

    @MockitoBean
    private CompletionProvider completionProvider;

    @Autowired
    private Orchestrator orchestrator;

    @Autowired
    private JsonChunkSource jsonChunkSource;

    @Autowired
    private OllamaChatModel ollamaChatModel;

    @Autowired
    private OllamaOptions defaultOllamaOptions;

    @Test
    void buildsChatModelFromConfiguredOptions() {
        assertThat(ollamaChatModel).isNotNull();
        assertThat(defaultOllamaOptions.getModel()).isEqualTo("llama3.1");
    }

    @Test
    void loadsFixtureCorpusAtStartup() {
        assertThat(jsonChunkSource.listReadyChunks(ChunkFilter.all())).hasSize(3);
        assertThat(jsonChunkSource.findDocument("doc-draft")).isPresent();
    }

    @Test
    void answersQuestionEndToEnd() {
        when(embeddingProvider.embed(anyString())).thenReturn(List.of(0.1, 1.0, 0.0));
        when(completionProvider.complete(anyString(), anyList()))
                .thenReturn("The invoice total is 1200 USD [Source 1].");

        QueryResponse response = orchestrator.answerQuery("What is the invoice total?", List.of());

        assertThat(response.getError()).isNull();
        assertThat(response.getCitations()).isNotEmpty();
        // doc-contract_1 shares the keywords but points elsewhere semantically
        assertThat(response.getCitations().get(0).getDocumentId()).isEqualTo("doc-invoice");
        assertThat(response.getMetadata()).containsEntry("terminal_state", "DONE");
    }

    @Test
    void runsDocumentChecklist() {
        when(completionProvider.complete(anyString(), anyList()))
                .thenReturn("- [ ] Deliver goods by 15 March\n- [ ] Pay within 30 days");

        UtilityResponse response = orchestrator.runUtility("doc-contract", "checklist", null);

        assertThat(response.getOutputText()).startsWith("- [ ]");
        assertThat(response.getMetadata()).containsEntry("document_title", "Supply contract");
    }

    @Test
    void refusesDocumentStillProcessing() {
        assertThatThrownBy(() -> orchestrator.runUtility("doc-draft", "summarize", null))
                .isInstanceOf(DocumentNotFoundException.class);
    }
}
