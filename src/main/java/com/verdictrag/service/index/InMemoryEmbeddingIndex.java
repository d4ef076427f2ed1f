package com.verdictrag.service.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.verdictrag.dto.internal.IndexStatistics;
import com.verdictrag.dto.internal.ScoredChunk;
import com.verdictrag.exception.MalformedInputException;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.service.embedding.EmbeddingFunction;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Brute-force cosine index over an immutable snapshot map. Writers compute vectors first
 * and then publish a new snapshot with a single compare-and-set, so queries never block
 * and never see a partially applied write.
 */
@Slf4j
public class InMemoryEmbeddingIndex implements EmbeddingIndex {

    // Equal scores: a chunk whose text is the query text ranks first, then lower chunk id
    private static final Comparator<ScoredCandidate> WORST_FIRST = Comparator
            .comparingDouble(ScoredCandidate::score)
            .thenComparing(ScoredCandidate::exactText)
            .thenComparing(c -> c.chunk().getId(), Comparator.reverseOrder());

    @Getter
    private final EmbeddingFunction embeddingFunction;

    @Getter
    private final int dimension;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public InMemoryEmbeddingIndex(EmbeddingFunction embeddingFunction, int dimension) {
        if (dimension <= 0) {
            throw new MalformedInputException("Index dimension must be positive: " + dimension);
        }
        if (embeddingFunction.dimension() != dimension) {
            throw MalformedInputException.dimensionMismatch(
                    "Embedding function " + embeddingFunction.modelName(), dimension,
                    embeddingFunction.dimension());
        }
        this.embeddingFunction = embeddingFunction;
        this.dimension = dimension;
        log.info("Embedding index ready | model={} | dimension={}", embeddingFunction.modelName(), dimension);
    }

    // ============================================================
    // Writes
    // ============================================================

    @Override
    public int add(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return 0;
        }
        List<Chunk> embedded = embedMissing(chunks);
        snapshot.updateAndGet(current -> current.withChunks(embedded));
        log.debug("Indexed {} chunks", embedded.size());
        return embedded.size();
    }

    @Override
    public int replace(String documentId, List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            if (!documentId.equals(chunk.getDocumentId())) {
                throw new MalformedInputException(String.format(
                        "Chunk %s belongs to %s, not %s", chunk.getId(), chunk.getDocumentId(), documentId));
            }
        }
        List<Chunk> embedded = embedMissing(chunks);

        int[] removed = new int[1];
        snapshot.updateAndGet(current -> {
            removed[0] = current.chunksOf(documentId).size();
            return current.withoutDocument(documentId).withChunks(embedded);
        });
        log.debug("Replaced document {} | removed={} | added={}", documentId, removed[0], embedded.size());
        return removed[0];
    }

    @Override
    public int delete(String documentId) {
        int[] removed = new int[1];
        snapshot.updateAndGet(current -> {
            removed[0] = current.chunksOf(documentId).size();
            return removed[0] == 0 ? current : current.withoutDocument(documentId);
        });
        if (removed[0] > 0) {
            log.debug("Deleted document {} ({} chunks)", documentId, removed[0]);
        }
        return removed[0];
    }

    @Override
    public int updateMetadata(String documentId, UnaryOperator<ChunkMetadata> edit) {
        int[] updated = new int[1];
        snapshot.updateAndGet(current -> {
            List<Chunk> existing = current.chunksOf(documentId);
            updated[0] = existing.size();
            if (existing.isEmpty()) {
                return current;
            }
            List<Chunk> retagged = existing.stream()
                    .map(chunk -> chunk.withMetadata(edit.apply(chunk.getMetadata())))
                    .toList();
            return current.withoutDocument(documentId).withChunks(retagged);
        });
        return updated[0];
    }

    /**
     * Swaps in a full chunk set, e.g. from a persisted snapshot. Vectors are required.
     */
    public void load(List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            if (!chunk.hasEmbedding()) {
                throw new MalformedInputException("Chunk " + chunk.getId() + " has no embedding");
            }
            checkDimension("Vector of chunk " + chunk.getId(), chunk.getEmbedding());
        }
        snapshot.set(Snapshot.EMPTY.withChunks(chunks));
        log.info("Index loaded with {} chunks", chunks.size());
    }

    // ============================================================
    // Reads
    // ============================================================

    @Override
    public List<ScoredChunk> query(String text, int k, ChunkFilter filter) {
        if (text == null || text.isBlank()) {
            throw new MalformedInputException("Query text is empty");
        }
        float[] vector = embeddingFunction.embed(text);
        checkDimension("Query vector", vector);
        return search(vector, text.strip(), k, filter);
    }

    @Override
    public List<ScoredChunk> query(float[] vector, int k, ChunkFilter filter) {
        checkDimension("Query vector", vector);
        return search(vector, null, k, filter);
    }

    private List<ScoredChunk> search(float[] query, String queryText, int k, ChunkFilter filter) {
        if (k <= 0) {
            throw new MalformedInputException("k must be positive: " + k);
        }
        ChunkFilter effective = filter != null ? filter : ChunkFilter.NONE;
        Snapshot view = snapshot.get();

        PriorityQueue<ScoredCandidate> heap = new PriorityQueue<>(k + 1, WORST_FIRST);

        for (List<Chunk> chunks : view.byDocument().values()) {
            for (Chunk chunk : chunks) {
                if (!effective.matches(chunk.getMetadata())) {
                    continue;
                }
                boolean exact = queryText != null && queryText.equals(chunk.getText().strip());
                heap.offer(new ScoredCandidate(chunk, chunk.similarityTo(query), exact));
                if (heap.size() > k) {
                    heap.poll();
                }
            }
        }

        List<ScoredCandidate> ranked = new ArrayList<>(heap);
        ranked.sort(WORST_FIRST.reversed());

        List<ScoredChunk> results = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            results.add(ScoredChunk.builder()
                    .chunk(ranked.get(i).chunk())
                    .score(ranked.get(i).score())
                    .rank(i + 1)
                    .build());
        }
        return results;
    }

    @Override
    public List<Chunk> chunksOf(String documentId) {
        return snapshot.get().chunksOf(documentId);
    }

    @Override
    public boolean contains(String documentId) {
        return snapshot.get().byDocument().containsKey(documentId);
    }

    @Override
    public Set<String> documentIds() {
        return snapshot.get().byDocument().keySet();
    }

    @Override
    public int size() {
        return snapshot.get().size();
    }

    /**
     * All chunks of the current snapshot, in document insertion order.
     */
    public List<Chunk> allChunks() {
        List<Chunk> all = new ArrayList<>();
        snapshot.get().byDocument().values().forEach(all::addAll);
        return all;
    }

    @Override
    public IndexStatistics statistics() {
        Snapshot view = snapshot.get();
        Set<String> jurisdictions = new TreeSet<>();
        Set<String> documentTypes = new TreeSet<>();
        for (List<Chunk> chunks : view.byDocument().values()) {
            for (Chunk chunk : chunks) {
                ChunkMetadata metadata = chunk.getMetadata();
                if (metadata == null) {
                    continue;
                }
                if (metadata.getJurisdiction() != null) {
                    jurisdictions.add(metadata.getJurisdiction());
                }
                if (metadata.getDocumentType() != null) {
                    documentTypes.add(metadata.getDocumentType().name());
                }
            }
        }
        return IndexStatistics.builder()
                .totalChunks(view.size())
                .uniqueDocuments(view.byDocument().size())
                .jurisdictions(jurisdictions)
                .documentTypes(documentTypes)
                .embeddingModel(embeddingFunction.modelName())
                .dimension(dimension)
                .build();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private List<Chunk> embedMissing(List<Chunk> chunks) {
        List<String> pendingTexts = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (chunk.hasEmbedding()) {
                checkDimension("Vector of chunk " + chunk.getId(), chunk.getEmbedding());
            } else {
                pendingTexts.add(chunk.getText());
            }
        }

        List<float[]> computed = pendingTexts.isEmpty()
                ? Collections.emptyList()
                : embeddingFunction.embedAll(pendingTexts);

        List<Chunk> result = new ArrayList<>(chunks.size());
        int next = 0;
        for (Chunk chunk : chunks) {
            if (chunk.hasEmbedding()) {
                result.add(chunk);
            } else {
                float[] vector = computed.get(next++);
                checkDimension("Computed vector of chunk " + chunk.getId(), vector);
                result.add(chunk.withEmbedding(vector));
            }
        }
        return result;
    }

    private void checkDimension(String what, float[] vector) {
        int actual = vector == null ? 0 : vector.length;
        if (actual != dimension) {
            throw MalformedInputException.dimensionMismatch(what, dimension, actual);
        }
    }

    private record ScoredCandidate(Chunk chunk, double score, boolean exactText) {
    }

    /**
     * Immutable view: document id to its chunks in ordinal order.
     */
    private record Snapshot(Map<String, List<Chunk>> byDocument, int size) {

        static final Snapshot EMPTY = new Snapshot(Collections.emptyMap(), 0);

        List<Chunk> chunksOf(String documentId) {
            return byDocument.getOrDefault(documentId, List.of());
        }

        Snapshot withChunks(List<Chunk> chunks) {
            Map<String, List<Chunk>> next = new LinkedHashMap<>(byDocument);
            Set<String> touched = new HashSet<>();
            for (Chunk chunk : chunks) {
                touched.add(chunk.getDocumentId());
            }
            for (String documentId : touched) {
                Map<String, Chunk> merged = new LinkedHashMap<>();
                for (Chunk existing : next.getOrDefault(documentId, List.of())) {
                    merged.put(existing.getId(), existing);
                }
                for (Chunk chunk : chunks) {
                    if (documentId.equals(chunk.getDocumentId())) {
                        merged.put(chunk.getId(), chunk);
                    }
                }
                List<Chunk> ordered = new ArrayList<>(merged.values());
                ordered.sort(Comparator.comparingInt(Chunk::getIndex));
                next.put(documentId, List.copyOf(ordered));
            }
            return of(next);
        }

        Snapshot withoutDocument(String documentId) {
            if (!byDocument.containsKey(documentId)) {
                return this;
            }
            Map<String, List<Chunk>> next = new LinkedHashMap<>(byDocument);
            next.remove(documentId);
            return of(next);
        }

        private static Snapshot of(Map<String, List<Chunk>> byDocument) {
            int size = byDocument.values().stream().mapToInt(List::size).sum();
            return new Snapshot(Collections.unmodifiableMap(byDocument), size);
        }
    }
}
