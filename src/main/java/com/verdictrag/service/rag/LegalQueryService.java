package com.verdictrag.service.rag;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

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
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.ConversationTurn;
import com.verdictrag.service.index.ChunkFilter;
import com.verdictrag.service.index.EmbeddingIndex;
import com.verdictrag.service.llm.LanguageModel;
import com.verdictrag.service.llm.LegalPrompt;
import com.verdictrag.service.monitoring.PerformanceMonitorService;
import com.verdictrag.service.monitoring.QueryTimer;
import com.verdictrag.util.PromptBuilder;
import com.verdictrag.util.TextChunker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Retrieval-augmented answering: top-k retrieval, prompt assembly, one model call.
 * Failures of the embedding or model backends come back as a {@link QueryFailure};
 * nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegalQueryService {

    private static final int EXCERPT_LENGTH = 200;

    private final EmbeddingIndex index;
    private final LanguageModel languageModel;
    private final PromptBuilder promptBuilder;
    private final TextChunker textChunker;
    private final PerformanceMonitorService performanceMonitor;
    private final LegalRagProperties properties;

    public QueryOutcome query(QueryRequest request) {
        String question = request.getQuestion();
        if (question == null || question.isBlank()) {
            throw new MalformedInputException("Question is empty");
        }

        QueryTimer timer = QueryTimer.started();

        List<ScoredChunk> retrieved;
        try {
            retrieved = retrieve(request);
        } catch (EmbeddingException e) {
            log.error("Retrieval failed for question: {}", e.getMessage());
            return fail(question, QueryFailure.Type.EMBEDDING_FAILURE, e.getMessage(), timer);
        }
        timer.mark("Retrieval");

        List<ConversationTurn> history = recentHistory(request.getHistory());
        LegalPrompt prompt = promptBuilder.build(question, retrieved, history);
        timer.mark("Prompt Assembly");

        String answer;
        try {
            answer = languageModel.generate(prompt, Duration.ofSeconds(properties.getLlm().getTimeoutSeconds()));
        } catch (ModelInvocationException e) {
            log.error("Generation failed | reason={} | {}", e.getReason(), e.getMessage());
            return fail(question, failureType(e.getReason()), e.getMessage(), timer);
        }
        if (answer == null || answer.isBlank()) {
            return fail(question, QueryFailure.Type.MODEL_ERROR, "Language model returned an empty answer", timer);
        }
        timer.mark("Generation");
        timer.end();

        boolean unsupported = retrieved.isEmpty();
        performanceMonitor.addQuery(question, timer, unsupported ? PerformanceMonitorService.UNSUPPORTED : PerformanceMonitorService.ANSWERED);
        log.info("Query answered | chunks={} | unsupported={} | {}", retrieved.size(), unsupported, timer.formatDisplay());

        return QueryOutcome.success(QueryResult.builder()
                .question(question)
                .retrieved(retrieved)
                .answer(answer)
                .sources(summarizeSources(retrieved))
                .unsupported(unsupported)
                .totalTime(timer.getTotalTime())
                .stepDurations(timer.getStepDurations())
                .build());
    }

    /**
     * Top-k chunks for the question, honouring the request's jurisdiction and document type.
     */
    public List<ScoredChunk> retrieve(QueryRequest request) {
        ChunkFilter filter = ChunkFilter.builder()
                .jurisdiction(request.getJurisdiction())
                .documentType(request.getDocumentType())
                .build();
        List<ScoredChunk> results = index.query(request.getQuestion(), properties.getTopK(), filter);
        log.debug("Retrieved {} chunks (topK={}, filter={})", results.size(), properties.getTopK(), filter);
        return results;
    }

    private List<ConversationTurn> recentHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        int limit = properties.getMaxHistoryTurns();
        return List.copyOf(history.subList(Math.max(0, history.size() - limit), history.size()));
    }

    /**
     * One summary per document, in retrieval order, capped at {@code maxSources}.
     */
    List<SourceSummary> summarizeSources(List<ScoredChunk> retrieved) {
        Map<String, SourceSummary> byDocument = new LinkedHashMap<>();
        int maxSources = properties.getRetrieval().getMaxSources();

        for (ScoredChunk scored : retrieved) {
            SourceSummary existing = byDocument.get(scored.getDocumentId());
            if (existing != null) {
                for (String citation : scored.getChunk().citationStrings()) {
                    if (!existing.getCitations().contains(citation)) {
                        existing.getCitations().add(citation);
                    }
                }
                continue;
            }
            if (byDocument.size() >= maxSources) {
                continue;
            }

            ChunkMetadata metadata = scored.getChunk().getMetadata();
            byDocument.put(scored.getDocumentId(), SourceSummary.builder()
                    .documentId(scored.getDocumentId())
                    .title(metadata != null ? metadata.getDocumentTitle() : null)
                    .jurisdiction(metadata != null ? metadata.getJurisdiction() : null)
                    .documentType(metadata != null ? metadata.getDocumentType() : null)
                    .citations(new ArrayList<>(scored.getChunk().citationStrings()))
                    .topScore(scored.getScore())
                    .excerpt(textChunker.truncate(scored.getText(), EXCERPT_LENGTH))
                    .build());
        }
        return new ArrayList<>(byDocument.values());
    }

    private QueryOutcome fail(String question, QueryFailure.Type type, String message, QueryTimer timer) {
        timer.end();
        performanceMonitor.addQuery(question, timer, type.name());
        return QueryOutcome.failure(QueryFailure.builder()
                .question(question)
                .type(type)
                .message(message)
                .build());
    }

    static QueryFailure.Type failureType(ModelInvocationException.Reason reason) {
        return switch (reason) {
            case TIMEOUT -> QueryFailure.Type.MODEL_TIMEOUT;
            case UNAVAILABLE -> QueryFailure.Type.MODEL_UNAVAILABLE;
            case INTERRUPTED -> QueryFailure.Type.CANCELLED;
            case UPSTREAM_ERROR, EMPTY_RESPONSE -> QueryFailure.Type.MODEL_ERROR;
        };
    }
}
