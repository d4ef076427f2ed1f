package com.verdictrag.service.data;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.verdictrag.model.Document;

import lombok.extern.slf4j.Slf4j;

/**
 * Catalogue of ingested documents, keyed by id. Holds the latest metadata so edits can
 * be returned to callers and re-applied to chunks.
 */
@Slf4j
@Service
public class DocumentStore {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    /**
     * @return the document previously stored under the same id, if any
     */
    public Optional<Document> put(Document document) {
        return Optional.ofNullable(documents.put(document.getId(), document));
    }

    public Optional<Document> get(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public Optional<Document> remove(String documentId) {
        return Optional.ofNullable(documents.remove(documentId));
    }

    public boolean contains(String documentId) {
        return documents.containsKey(documentId);
    }

    public Collection<Document> all() {
        return List.copyOf(documents.values());
    }

    public int size() {
        return documents.size();
    }
}
