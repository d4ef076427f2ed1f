package com.verdictrag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.verdictrag.TestFixtures;
import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.dto.internal.ScoredChunk;
import com.verdictrag.dto.internal.SourceSummary;
import com.verdictrag.dto.request.QueryRequest;
import com.verdictrag.dto.response.QueryFailure;
import com.verdictrag.dto.response.QueryOutcome;
import com.verdictrag.dto.response.QueryResult;
import com.verdictrag.exception.EmbeddingException;
import com.verdictrag.exception.MalformedInputException;
import com.verdictrag.exception.ModelInvocationException;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.ConversationTurn;
import com.verdictrag.model.DocumentType;
import com.verdictrag.service.embedding.EmbeddingFunction;
import com.verdictrag.service.index.InMemoryEmbeddingIndex;
import com.verdictrag.service.llm.LanguageModel;
import com.verdictrag.service.llm.LegalPrompt;
import com.verdictrag.service.monitoring.PerformanceMonitorService;
import com.verdictrag.util.PromptBuilder;
import com.verdictrag.util.TextChunker;

class LegalQueryServiceTest {

    private LegalRagProperties properties;
    private InMemoryEmbeddingIndex index;
    private LanguageModel languageModel;
    private PerformanceMonitorService monitor;
    private LegalQueryService service;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        index = TestFixtures.index();
        languageModel = mock(LanguageModel.class);
        monitor = new PerformanceMonitorService(properties);
        service = serviceOver(index);
    }

    private LegalQueryService serviceOver(InMemoryEmbeddingIndex target) {
        return new LegalQueryService(target, languageModel, new PromptBuilder(), new TextChunker(), monitor, properties);
    }

    private static Chunk chunk(String documentId, int ordinal, String jurisdiction, String text) {
        return Chunk.builder()
                .id(Chunk.chunkId(documentId, ordinal))
                .documentId(documentId)
                .index(ordinal)
                .text(text)
                .metadata(ChunkMetadata.builder()
                        .documentId(documentId)
                        .documentTitle("Title " + documentId)
                        .chunkIndex(ordinal)
                        .jurisdiction(jurisdiction)
                        .documentType(DocumentType.JUDGMENT)
                        .build())
                .build();
    }

    private void seedLeaseCorpus() {
        List<Chunk> chunks = new ArrayList<>();
        for (String doc : List.of("a", "b", "c", "d")) {
            String jurisdiction = doc.equals("d") ? "Western Cape" : "South Africa";
            chunks.add(chunk(doc, 0, jurisdiction, "lease cancellation notice tenant " + doc + " landlord breach"));
            chunks.add(chunk(doc, 1, jurisdiction, "lease cancellation notice period " + doc + " rental arrears"));
        }
        index.add(chunks);
    }

    private String capturedUserPrompt() {
        ArgumentCaptor<LegalPrompt> captor = ArgumentCaptor.forClass(LegalPrompt.class);
        verify(languageModel).generate(captor.capture(), any(Duration.class));
        return captor.getValue().user();
    }

    private static QueryRequest request(String question) {
        return QueryRequest.builder().question(question).build();
    }

    @Nested
    @DisplayName("Answering")
    class Answering {

        @Test
        @DisplayName("empty index still calls the model once and flags the result unsupported")
        void emptyIndex() {
            when(languageModel.generate(any(), any())).thenReturn("The collection does not cover this question.");

            QueryOutcome outcome = service.query(request("What is the notice period for a lease?"));

            assertThat(outcome.isSuccess()).isTrue();
            QueryResult result = outcome.getResult();
            assertThat(result.isUnsupported()).isTrue();
            assertThat(result.getRetrieved()).isEmpty();
            assertThat(result.getSources()).isEmpty();
            assertThat(capturedUserPrompt()).contains("No relevant context was found");
        }

        @Test
        @DisplayName("retrieves top five chunks and summarises at most three distinct documents")
        void sources() {
            seedLeaseCorpus();
            when(languageModel.generate(any(), any())).thenReturn("Notice must be given before cancellation.");

            QueryResult result = service.query(request("lease cancellation notice")).getResult();

            assertThat(result.isUnsupported()).isFalse();
            assertThat(result.getRetrieved()).hasSize(5);
            assertThat(result.getSources()).hasSizeLessThanOrEqualTo(3);
            assertThat(result.getSources()).extracting(SourceSummary::getDocumentId).doesNotHaveDuplicates();

            List<String> firstSeen = result.getRetrieved().stream()
                    .map(ScoredChunk::getDocumentId)
                    .distinct()
                    .limit(3)
                    .toList();
            assertThat(result.getSources()).extracting(SourceSummary::getDocumentId)
                    .containsExactlyElementsOf(firstSeen);
            assertThat(result.getStepDurations()).containsKeys("Retrieval", "Prompt Assembly", "Generation");
            verify(languageModel, times(1)).generate(any(), any());
        }

        @Test
        @DisplayName("jurisdiction restricts retrieval")
        void jurisdiction() {
            seedLeaseCorpus();
            when(languageModel.generate(any(), any())).thenReturn("Answer.");

            QueryResult result = service.query(QueryRequest.builder()
                    .question("lease cancellation notice")
                    .jurisdiction("Western Cape")
                    .build()).getResult();

            assertThat(result.getRetrieved()).extracting(ScoredChunk::getDocumentId).containsOnly("d");
        }

        @Test
        @DisplayName("only the five most recent turns reach the prompt")
        void historyBound() {
            when(languageModel.generate(any(), any())).thenReturn("Answer.");
            List<ConversationTurn> history = new ArrayList<>();
            for (String label : List.of("turn-A", "turn-B", "turn-C", "turn-D", "turn-E", "turn-F", "turn-G", "turn-H")) {
                history.add(new ConversationTurn(label + " question", label + " answer"));
            }

            service.query(QueryRequest.builder().question("Follow-up?").history(history).build());

            String user = capturedUserPrompt();
            assertThat(user).contains("turn-D question", "turn-E question", "turn-H answer");
            assertThat(user).doesNotContain("turn-A", "turn-B", "turn-C");
        }

        @Test
        @DisplayName("blank question is rejected")
        void blankQuestion() {
            assertThatThrownBy(() -> service.query(request("  ")))
                    .isInstanceOf(MalformedInputException.class);
            verify(languageModel, never()).generate(any(), any());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("model timeout becomes a typed failure without an answer")
        void timeout() {
            when(languageModel.generate(any(), any())).thenThrow(ModelInvocationException.timeout(100));

            QueryOutcome outcome = service.query(request("What is prescription?"));

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getFailure().getType()).isEqualTo(QueryFailure.Type.MODEL_TIMEOUT);
            assertThatThrownBy(outcome::getResult).isInstanceOf(IllegalStateException.class);
            assertThat(outcome.getFailure().userFacing()).contains("technical problem");
        }

        @Test
        @DisplayName("model failure reasons map to failure types")
        void reasonMapping() {
            assertThat(LegalQueryService.failureType(ModelInvocationException.Reason.UNAVAILABLE))
                    .isEqualTo(QueryFailure.Type.MODEL_UNAVAILABLE);
            assertThat(LegalQueryService.failureType(ModelInvocationException.Reason.INTERRUPTED))
                    .isEqualTo(QueryFailure.Type.CANCELLED);
            assertThat(LegalQueryService.failureType(ModelInvocationException.Reason.UPSTREAM_ERROR))
                    .isEqualTo(QueryFailure.Type.MODEL_ERROR);
            assertThat(LegalQueryService.failureType(ModelInvocationException.Reason.EMPTY_RESPONSE))
                    .isEqualTo(QueryFailure.Type.MODEL_ERROR);
        }

        @Test
        @DisplayName("embedding failure is reported before the model is called")
        void embeddingFailure() {
            EmbeddingFunction broken = new EmbeddingFunction() {
                @Override
                public String modelName() {
                    return "broken";
                }

                @Override
                public int dimension() {
                    return TestFixtures.DIMENSION;
                }

                @Override
                public float[] embed(String text) {
                    throw new EmbeddingException("embedding service down");
                }
            };
            LegalQueryService brokenService = serviceOver(new InMemoryEmbeddingIndex(broken, TestFixtures.DIMENSION));

            QueryOutcome outcome = brokenService.query(request("What is prescription?"));

            assertThat(outcome.getFailure().getType()).isEqualTo(QueryFailure.Type.EMBEDDING_FAILURE);
            verify(languageModel, never()).generate(any(), any());
        }

        @Test
        @DisplayName("failed queries are recorded by the performance monitor")
        void monitored() {
            when(languageModel.generate(any(), any()))
                    .thenThrow(new ModelInvocationException(ModelInvocationException.Reason.UNAVAILABLE, "circuit open"));

            QueryOutcome outcome = service.query(request("What is prescription?"));

            assertThat(outcome.getFailure().getType()).isEqualTo(QueryFailure.Type.MODEL_UNAVAILABLE);
            assertThat(monitor.getStatistics()).containsEntry("totalQueries", 1);
        }
    }
}
