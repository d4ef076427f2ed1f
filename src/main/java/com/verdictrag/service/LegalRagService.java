package com.verdictrag.service;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.verdictrag.dto.internal.IndexStatistics;
import com.verdictrag.dto.request.DocumentMetadataUpdate;
import com.verdictrag.dto.request.QueryRequest;
import com.verdictrag.dto.response.DeletionAck;
import com.verdictrag.dto.response.IngestionReceipt;
import com.verdictrag.dto.response.QualityReport;
import com.verdictrag.dto.response.QueryOutcome;
import com.verdictrag.dto.response.QueryResult;
import com.verdictrag.dto.response.ScoredAnswer;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.ConversationTurn;
import com.verdictrag.model.Document;
import com.verdictrag.service.index.EmbeddingIndex;
import com.verdictrag.service.ingestion.IngestionService;
import com.verdictrag.service.monitoring.PerformanceMonitorService;
import com.verdictrag.service.quality.QualityValidator;
import com.verdictrag.service.rag.LegalQueryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the pipeline: ingestion, question answering, answer validation and
 * document maintenance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegalRagService {

    private final IngestionService ingestionService;
    private final LegalQueryService queryService;
    private final QualityValidator qualityValidator;
    private final EmbeddingIndex index;
    private final PerformanceMonitorService performanceMonitor;

    public IngestionReceipt ingest(Document document) {
        return ingestionService.ingest(document);
    }

    public QueryOutcome query(String question, String jurisdiction, List<ConversationTurn> history) {
        return query(QueryRequest.builder()
                .question(question)
                .jurisdiction(jurisdiction)
                .history(history != null ? history : List.of())
                .build());
    }

    public QueryOutcome query(QueryRequest request) {
        return queryService.query(request);
    }

    public QualityReport validate(String question, String answer, List<Chunk> chunks) {
        return qualityValidator.validate(question, answer, chunks);
    }

    /**
     * Query, then validate the answer against the chunks it was generated from.
     */
    public ScoredAnswer ask(String question, String jurisdiction, List<ConversationTurn> history) {
        return ask(QueryRequest.builder()
                .question(question)
                .jurisdiction(jurisdiction)
                .history(history != null ? history : List.of())
                .build());
    }

    public ScoredAnswer ask(QueryRequest request) {
        QueryOutcome outcome = queryService.query(request);
        if (!outcome.isSuccess()) {
            return ScoredAnswer.builder().outcome(outcome).build();
        }

        QueryResult result = outcome.getResult();
        QualityReport report = qualityValidator.validate(result.getQuestion(), result.getAnswer(), result.getChunks());
        log.info("Answer scored | level={} | composite={}", report.getLevel(),
                String.format("%.3f", report.getCompositeScore()));

        return ScoredAnswer.builder()
                .outcome(outcome)
                .report(report)
                .build();
    }

    public DeletionAck deleteDocument(String documentId) {
        return ingestionService.delete(documentId);
    }

    public Document updateDocumentMetadata(String documentId, DocumentMetadataUpdate update) {
        return ingestionService.updateMetadata(documentId, update);
    }

    public IndexStatistics indexStatistics() {
        return index.statistics();
    }

    public Map<String, Object> performanceStatistics() {
        return performanceMonitor.getStatistics();
    }
}
