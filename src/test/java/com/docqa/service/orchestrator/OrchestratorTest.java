package com.docqa.service.orchestrator;

import com.docqa.config.ModelConfig;
import com.docqa.dto.internal.ChatTurn;
import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ChunkFilter;
import com.docqa.dto.internal.DocumentRef;
import com.docqa.dto.internal.DocumentStatus;
import com.docqa.dto.response.QueryResponse;
import com.docqa.dto.response.UtilityResponse;
import com.docqa.exception.CompletionException;
import com.docqa.exception.DocumentNotFoundException;
import com.docqa.exception.InvalidArgumentException;
import com.docqa.exception.RetrievalException;
import com.docqa.exception.UtilityException;
import com.docqa.service.data.ChunkSource;
import com.docqa.service.embedding.EmbeddingProvider;
import com.docqa.service.llm.CompletionProvider;
import com.docqa.service.rag.DiversityReranker;
import com.docqa.service.rag.HybridRetriever;
import com.docqa.service.rag.LexicalRanker;
import com.docqa.service.rag.ScoreFusionService;
import com.docqa.service.rag.SemanticRanker;
import com.docqa.service.reasoning.ReasoningStage;
import com.docqa.service.routing.IntentRouter;
import com.docqa.service.routing.TranslationTargetResolver;
import com.docqa.service.utility.UtilityStage;
import com.docqa.util.PromptBuilder;
import com.docqa.util.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.docqa.support.TestChunks.chunk;
import static com.docqa.support.TestChunks.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrchestratorTest {

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private CompletionProvider completionProvider;

    @Mock
    private ChunkSource chunkSource;

    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ModelConfig modelConfig = new ModelConfig();
        Tokenizer tokenizer = new Tokenizer();
        PromptBuilder promptBuilder = new PromptBuilder();

        HybridRetriever retriever = new HybridRetriever(
                embeddingProvider,
                new LexicalRanker(tokenizer, modelConfig),
                new SemanticRanker(),
                new ScoreFusionService(),
                new DiversityReranker(),
                modelConfig);

        orchestrator = new Orchestrator(
                new IntentRouter(tokenizer, modelConfig),
                retriever,
                new ReasoningStage(completionProvider, promptBuilder, modelConfig),
                new UtilityStage(completionProvider, promptBuilder, modelConfig),
                new TranslationTargetResolver(tokenizer),
                chunkSource,
                modelConfig);
    }

    @Nested
    @DisplayName("answerQuery")
    class AnswerQuery {

        @Test
        @DisplayName("empty corpus yields the no-content answer")
        void emptyCorpus() {
            when(chunkSource.listReadyChunks(any())).thenReturn(List.of());

            QueryResponse response = orchestrator.answerQuery("what is X?", List.of());

            assertThat(response.getAnswer()).isEqualTo(PromptBuilder.NO_CONTEXT_ANSWER);
            assertThat(response.getCitations()).isEmpty();
            assertThat(response.isDegraded()).isFalse();
            assertThat(response.getMetadata())
                    .containsEntry("terminal_state", "DONE")
                    .containsEntry("intent", "RAG_QUERY")
                    .containsEntry("num_retrieved", 0)
                    .containsKey("timing");
            verifyNoInteractions(embeddingProvider, completionProvider);
        }

        @Test
        void answersFromRetrievedChunksWithCitations() {
            when(chunkSource.listReadyChunks(ChunkFilter.all())).thenReturn(invoiceCorpus());
            when(embeddingProvider.embed("What is the invoice total?")).thenReturn(vector(1.0, 0.0));
            when(completionProvider.complete(anyString(), anyList()))
                    .thenReturn("The amount billed is 1200 dollars [Source 1].");

            QueryResponse response = orchestrator.answerQuery("What is the invoice total?",
                    List.of(ChatTurn.user("hi"), ChatTurn.assistant("hello")));

            assertThat(response.getAnswer()).contains("1200");
            assertThat(response.getCitations()).singleElement()
                    .satisfies(citation -> assertThat(citation.getDocumentId()).isEqualTo("doc-b"));
            assertThat(response.getMetadata())
                    .containsEntry("agent", "rag")
                    .containsEntry("num_candidates", 2)
                    .containsEntry("num_retrieved", 2)
                    .containsEntry("alpha", 0.7)
                    .containsEntry("terminal_state", "DONE")
                    .containsKey("confidence");
        }

        @Test
        void retrievalFailureEndsInErroredState() {
            when(chunkSource.listReadyChunks(ChunkFilter.all())).thenReturn(invoiceCorpus());
            when(embeddingProvider.embed(anyString())).thenThrow(new RetrievalException("embedding down"));

            QueryResponse response = orchestrator.answerQuery("What is the invoice total?", List.of());

            assertThat(response.getAnswer()).isEqualTo(PromptBuilder.RETRIEVAL_FAILURE_ANSWER);
            assertThat(response.getError()).isEqualTo("embedding down");
            assertThat(response.getMetadata()).containsEntry("terminal_state", "ERRORED");
            verifyNoInteractions(completionProvider);
        }

        @Test
        void embeddingDimensionMismatchEndsInErroredState() {
            when(chunkSource.listReadyChunks(ChunkFilter.all())).thenReturn(invoiceCorpus());
            when(embeddingProvider.embed(anyString())).thenReturn(vector(1.0, 0.0, 0.0));

            QueryResponse response = orchestrator.answerQuery("invoice total", List.of());

            assertThat(response.getAnswer()).isEqualTo(PromptBuilder.RETRIEVAL_FAILURE_ANSWER);
            assertThat(response.getError()).contains("dimension mismatch");
            assertThat(response.getMetadata()).containsEntry("terminal_state", "ERRORED");
            verifyNoInteractions(completionProvider);
        }

        @Test
        void completionFailureEndsInErroredState() {
            when(chunkSource.listReadyChunks(ChunkFilter.all())).thenReturn(invoiceCorpus());
            when(embeddingProvider.embed(anyString())).thenReturn(vector(1.0, 0.0));
            when(completionProvider.complete(anyString(), anyList()))
                    .thenThrow(new CompletionException("model offline"));

            QueryResponse response = orchestrator.answerQuery("What is the invoice total?", List.of());

            assertThat(response.getAnswer()).isEqualTo(PromptBuilder.APOLOGY_ANSWER);
            assertThat(response.getCitations()).isEmpty();
            assertThat(response.isDegraded()).isTrue();
            assertThat(response.getMetadata()).containsEntry("terminal_state", "ERRORED");
        }

        @Test
        void unexpectedFailurePropagates() {
            when(chunkSource.listReadyChunks(any())).thenThrow(new IllegalStateException("store corrupted"));

            assertThatThrownBy(() -> orchestrator.answerQuery("What is the invoice total?", List.of()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void blankQueryIsRejected() {
            assertThatThrownBy(() -> orchestrator.answerQuery("  ", List.of()))
                    .isInstanceOf(InvalidArgumentException.class);
        }
    }

    @Nested
    @DisplayName("answerQuery with a utility intent")
    class ChatUtility {

        @Test
        void summarizesTheMessageWithoutRetrieval() {
            when(completionProvider.complete(anyString(), anyList())).thenReturn("Short version.");

            QueryResponse response = orchestrator.answerQuery(
                    "Summarize: the supplier ships in March and the buyer pays in April.", null);

            assertThat(response.getAnswer()).isEqualTo("Short version.");
            assertThat(response.getMetadata())
                    .containsEntry("intent", "SUMMARIZE")
                    .containsEntry("agent", "utility")
                    .containsEntry("utility_function", "summarize")
                    .containsEntry("terminal_state", "DONE");
            verifyNoInteractions(embeddingProvider, chunkSource);
        }

        @Test
        void translationResolvesTargetFromMessage() {
            when(completionProvider.complete(anyString(), anyList())).thenReturn("Bonjour");

            QueryResponse response = orchestrator.answerQuery("Translate to French: good morning", List.of());

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionProvider).complete(prompt.capture(), anyList());
            assertThat(prompt.getValue()).contains("Translate the following text to French");
            assertThat(response.getMetadata()).containsEntry("target_language", "French");
        }

        @Test
        void utilityFailureEndsInErroredState() {
            when(completionProvider.complete(anyString(), anyList())).thenThrow(new CompletionException("busy"));

            QueryResponse response = orchestrator.answerQuery("Make a checklist: call the bank", List.of());

            assertThat(response.getAnswer()).isEqualTo(Orchestrator.UTILITY_FAILURE_ANSWER);
            assertThat(response.getError()).isNotBlank();
            assertThat(response.getMetadata()).containsEntry("terminal_state", "ERRORED");
        }
    }

    @Nested
    @DisplayName("runUtility")
    class RunUtility {

        @Test
        void summarizesWholeDocumentInSequenceOrder() {
            when(chunkSource.findDocument("doc-a")).thenReturn(Optional.of(readyDocument()));
            when(chunkSource.listReadyChunks(ChunkFilter.forDocument("doc-a"))).thenReturn(List.of(
                    chunk("a0", "doc-a", 0, "First part.", 1.0),
                    chunk("a1", "doc-a", 1, "Second part.", 1.0)));
            when(completionProvider.complete(anyString(), anyList())).thenReturn("Summary.");

            UtilityResponse response = orchestrator.runUtility("doc-a", "summarize", null);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionProvider).complete(prompt.capture(), anyList());
            assertThat(prompt.getValue()).contains("First part.\n\nSecond part.");
            assertThat(response.getOutputText()).isEqualTo("Summary.");
            assertThat(response.getMetadata())
                    .containsEntry("utility_function", "summarize")
                    .containsEntry("document_id", "doc-a")
                    .containsEntry("document_title", "Supply contract")
                    .containsEntry("terminal_state", "DONE");
            verifyNoInteractions(embeddingProvider);
        }

        @Test
        @DisplayName("document with no text is an invalid request")
        void emptyDocument() {
            when(chunkSource.findDocument("doc-a")).thenReturn(Optional.of(readyDocument()));
            when(chunkSource.listReadyChunks(ChunkFilter.forDocument("doc-a"))).thenReturn(List.of());

            assertThatThrownBy(() -> orchestrator.runUtility("doc-a", "summarize", null))
                    .isInstanceOf(InvalidArgumentException.class);
            verifyNoInteractions(completionProvider);
        }

        @Test
        void unknownOrUnreadyDocumentIsNotFound() {
            when(chunkSource.findDocument("missing")).thenReturn(Optional.empty());
            when(chunkSource.findDocument("pending")).thenReturn(Optional.of(DocumentRef.builder()
                    .id("pending").title("Pending").status(DocumentStatus.PROCESSING).build()));

            assertThatThrownBy(() -> orchestrator.runUtility("missing", "checklist", null))
                    .isInstanceOf(DocumentNotFoundException.class);
            assertThatThrownBy(() -> orchestrator.runUtility("pending", "checklist", null))
                    .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        void rejectsBadArguments() {
            assertThatThrownBy(() -> orchestrator.runUtility("doc-a", "rewrite", null))
                    .isInstanceOf(InvalidArgumentException.class);
            assertThatThrownBy(() -> orchestrator.runUtility(" ", "summarize", null))
                    .isInstanceOf(InvalidArgumentException.class);
            verifyNoInteractions(chunkSource);
        }

        @Test
        void translationRequiresTargetLanguage() {
            when(chunkSource.findDocument("doc-a")).thenReturn(Optional.of(readyDocument()));
            when(chunkSource.listReadyChunks(ChunkFilter.forDocument("doc-a")))
                    .thenReturn(List.of(chunk("a0", "doc-a", 0, "First part.", 1.0)));

            assertThatThrownBy(() -> orchestrator.runUtility("doc-a", "translate", ""))
                    .isInstanceOf(InvalidArgumentException.class);
        }

        @Test
        void providerFailureSurfacesAsUtilityException() {
            when(chunkSource.findDocument("doc-a")).thenReturn(Optional.of(readyDocument()));
            when(chunkSource.listReadyChunks(ChunkFilter.forDocument("doc-a")))
                    .thenReturn(List.of(chunk("a0", "doc-a", 0, "First part.", 1.0)));
            when(completionProvider.complete(anyString(), anyList())).thenThrow(new CompletionException("busy"));

            assertThatThrownBy(() -> orchestrator.runUtility("doc-a", "translate", "German"))
                    .isInstanceOf(UtilityException.class);
        }
    }

    private List<Chunk> invoiceCorpus() {
        return List.of(
                chunk("exact", "doc-a", 0, "Invoice total: 1200 USD", 0.0, 1.0),
                chunk("paraphrase", "doc-b", 0, "The amount billed comes to 1200 dollars", 1.0, 0.0));
    }

    private DocumentRef readyDocument() {
        return DocumentRef.builder().id("doc-a").title("Supply contract").status(DocumentStatus.READY).build();
    }
}
