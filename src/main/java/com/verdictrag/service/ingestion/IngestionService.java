package com.verdictrag.service.ingestion;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Service;

import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.dto.request.DocumentMetadataUpdate;
import com.verdictrag.dto.response.DeletionAck;
import com.verdictrag.dto.response.IngestionReceipt;
import com.verdictrag.exception.MalformedInputException;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.Document;
import com.verdictrag.service.data.DocumentStore;
import com.verdictrag.service.index.EmbeddingIndex;
import com.verdictrag.util.ChunkingOptions;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    public static final String TYPE_CONFIDENCE_KEY = "documentTypeConfidence";

    private static final int LOCK_STRIPES = 64;

    private final DocumentChunker documentChunker;
    private final DocumentClassifier documentClassifier;
    private final EmbeddingIndex index;
    private final DocumentStore documentStore;
    private final LegalRagProperties properties;

    // Serialises index and catalogue writes per document id
    private final Object[] documentLocks = newLocks();

    /**
     * Chunks, embeds and indexes a document. Re-ingesting an id replaces its chunks in a
     * single index write.
     */
    public IngestionReceipt ingest(Document document) {
        if (document == null || document.getId() == null || document.getId().isBlank()) {
            throw new MalformedInputException("Document id is required");
        }
        if (document.getText() == null || document.getText().isBlank()) {
            throw new MalformedInputException("Document " + document.getId() + " has no text");
        }

        long start = System.currentTimeMillis();
        Document labelled = withDocumentType(document);
        List<Chunk> chunks = documentChunker.chunk(labelled, ChunkingOptions.from(properties.getChunking()));
        int removed;
        synchronized (lockFor(document.getId())) {
            removed = index.replace(document.getId(), chunks);
            documentStore.put(labelled);
        }

        Set<String> citations = new LinkedHashSet<>();
        chunks.forEach(chunk -> citations.addAll(chunk.citationStrings()));

        log.info("Ingested {} | type={} | chunks={} | citations={} | replaced={} | time={}ms",
                document.getId(), labelled.getDocumentType(), chunks.size(), citations.size(), removed > 0,
                System.currentTimeMillis() - start);

        return IngestionReceipt.builder()
                .documentId(document.getId())
                .chunkCount(chunks.size())
                .citationCount(citations.size())
                .replacedExisting(removed > 0)
                .build();
    }

    public DeletionAck delete(String documentId) {
        int removed;
        boolean known;
        synchronized (lockFor(documentId)) {
            removed = index.delete(documentId);
            known = documentStore.remove(documentId).isPresent();
        }

        if (removed > 0 || known) {
            log.info("Deleted document {} ({} chunks)", documentId, removed);
        } else {
            log.debug("Delete ignored, unknown document {}", documentId);
        }

        return DeletionAck.builder()
                .documentId(documentId)
                .deleted(removed > 0 || known)
                .chunksRemoved(removed)
                .build();
    }

    /**
     * Applies a metadata edit to the document and re-tags its chunks without re-embedding.
     */
    public Document updateMetadata(String documentId, DocumentMetadataUpdate update) {
        int updated;
        Document edited;
        synchronized (lockFor(documentId)) {
            if (!index.contains(documentId) && !documentStore.contains(documentId)) {
                throw new MalformedInputException("Unknown document " + documentId);
            }

            updated = index.updateMetadata(documentId, retag(update));

            Document current = documentStore.get(documentId)
                    .orElseGet(() -> fromIndexedMetadata(documentId));
            edited = apply(current, update);
            documentStore.put(edited);
        }

        log.info("Updated metadata of {} ({} chunks re-tagged)", documentId, updated);
        return edited;
    }

    /**
     * Keeps an explicit type; otherwise classifies the text and records the confidence in
     * {@code extra} under {@value #TYPE_CONFIDENCE_KEY}. The returned document owns a copy of
     * {@code extra}.
     */
    private Document withDocumentType(Document document) {
        if (document.getDocumentType() != null) {
            return document.toBuilder()
                    .extra(document.getExtra() != null ? Map.copyOf(document.getExtra()) : Map.of())
                    .build();
        }
        DocumentClassifier.Classification classification = documentClassifier.classify(document.getText());

        Map<String, String> extra = new LinkedHashMap<>(document.getExtra() != null ? document.getExtra() : Map.of());
        extra.put(TYPE_CONFIDENCE_KEY, String.format(Locale.ROOT, "%.3f", classification.confidence()));

        log.debug("Document {} classified as {} ({})", document.getId(), classification.type(),
                extra.get(TYPE_CONFIDENCE_KEY));
        return document.toBuilder()
                .documentType(classification.type())
                .extra(Map.copyOf(extra))
                .build();
    }

    private Object lockFor(String documentId) {
        return documentLocks[Math.floorMod(Objects.hashCode(documentId), LOCK_STRIPES)];
    }

    private static Object[] newLocks() {
        Object[] locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
        return locks;
    }

    private UnaryOperator<ChunkMetadata> retag(DocumentMetadataUpdate update) {
        return metadata -> {
            ChunkMetadata.ChunkMetadataBuilder builder = metadata.toBuilder();
            if (update.getTitle() != null) {
                builder.documentTitle(update.getTitle());
            }
            if (update.getJurisdiction() != null) {
                builder.jurisdiction(update.getJurisdiction());
            }
            if (update.getDocumentType() != null) {
                builder.documentType(update.getDocumentType());
            }
            if (update.getExtra() != null) {
                builder.extra(Map.copyOf(update.getExtra()));
            }
            return builder.build();
        };
    }

    private Document apply(Document document, DocumentMetadataUpdate update) {
        Document.DocumentBuilder builder = document.toBuilder();
        if (update.getTitle() != null) {
            builder.title(update.getTitle());
        }
        if (update.getJurisdiction() != null) {
            builder.jurisdiction(update.getJurisdiction());
        }
        if (update.getDocumentType() != null) {
            builder.documentType(update.getDocumentType());
        }
        if (update.getExtra() != null) {
            builder.extra(Map.copyOf(update.getExtra()));
        }
        return builder.build();
    }

    // Documents restored from an index snapshot have no catalogue entry; rebuild one from chunk metadata
    private Document fromIndexedMetadata(String documentId) {
        List<Chunk> chunks = index.chunksOf(documentId);
        StringBuilder text = new StringBuilder();
        for (Chunk chunk : chunks) {
            text.append(chunk.getText().substring(Math.min(chunk.getOverlapWithPrevious(), chunk.getText().length())));
        }
        ChunkMetadata metadata = chunks.isEmpty() ? null : chunks.get(0).getMetadata();
        Document.DocumentBuilder builder = Document.builder().id(documentId).text(text.toString());
        if (metadata != null) {
            builder.title(metadata.getDocumentTitle())
                    .jurisdiction(metadata.getJurisdiction())
                    .extra(metadata.getExtra());
            if (metadata.getDocumentType() != null) {
                builder.documentType(metadata.getDocumentType());
            }
        }
        return builder.build();
    }
}
