package com.replymail.rag;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.DocumentChunk;
import com.replymail.domain.KnowledgeDocument;
import com.replymail.domain.ScoredChunk;
import com.replymail.exception.AssistantException;
import com.replymail.exception.IndexCapacityExceededException;
import com.replymail.exception.RetrievalUnavailableException;
import com.replymail.mapper.DocumentChunkMapper;
import com.replymail.pipeline.OperationKind;
import com.replymail.pipeline.RetryPolicy;
import com.replymail.util.TextNormalizer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Vector-similarity index over ingested documents
 * - Chunks persisted in document_chunk, mirrored in memory for scoring
 * - Additive ingestion; replacement means explicit removal first
 * - Fails closed at capacity: nothing is evicted, nothing is added
 */
@Slf4j
@Component
@DependsOn("dataSourceInitializer")
@RequiredArgsConstructor
public class RetrievalIndex {

    /** Rows per INSERT; 10 bound variables each */
    static final int INSERT_BATCH_SIZE = 200;

    private static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(sc -> ingestedAt(sc.chunk()), Comparator.reverseOrder());

    private final DocumentChunkMapper mapper;
    private final EmbeddingModel embeddingModel;
    private final TextChunker chunker;
    private final RetryPolicy retryPolicy;
    private final AssistantProperties properties;

    private final List<DocumentChunk> chunks = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @PostConstruct
    public void load() {
        List<DocumentChunk> stored = mapper.findAll();
        lock.writeLock().lock();
        try {
            chunks.clear();
            chunks.addAll(stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Retrieval index loaded: {} chunk(s), capacity {}", stored.size(),
                properties.getRetrieval().getMaxIndexSize());
    }

    /**
     * Split, embed and store a document
     *
     * @return ids of the created chunks, in document order
     * @throws IndexCapacityExceededException when the new chunks would exceed the configured maximum
     * @throws RetrievalUnavailableException when embedding or storage fails; the index is unchanged
     */
    public List<String> ingest(KnowledgeDocument document) {
        String content = TextNormalizer.normalize(document.content());
        if (content.isEmpty()) {
            throw new AssistantException("EMPTY_DOCUMENT", "Document has no text content");
        }
        List<String> pieces = chunker.split(content);
        checkCapacity(pieces.size());

        // 1. Embed outside the lock
        List<Embedding> vectors;
        try {
            List<TextSegment> segments = pieces.stream().map(TextSegment::from).toList();
            vectors = retryPolicy.execute(OperationKind.EMBED, () -> embeddingModel.embedAll(segments).content());
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException("Embedding failed: " + e.getMessage(), e);
        }
        if (vectors == null || vectors.size() != pieces.size()) {
            throw new RetrievalUnavailableException("Embedding service returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + pieces.size() + " chunks", null);
        }

        // 2. Build chunks
        String documentId = document.documentId() == null || document.documentId().isBlank()
                ? UUID.randomUUID().toString()
                : document.documentId();
        String ingestedAt = Instant.now().toString();
        String topics = String.join(",", document.topics());
        List<DocumentChunk> created = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            created.add(DocumentChunk.builder()
                    .chunkId(UUID.randomUUID().toString())
                    .documentId(documentId)
                    .chunkIndex(i)
                    .content(pieces.get(i))
                    .embedding(vectors.get(i).vector())
                    .title(TextNormalizer.clean(document.title()))
                    .source(document.source())
                    .url(document.url())
                    .topics(topics)
                    .ingestedAt(ingestedAt)
                    .build());
        }

        // 3. Re-check and store atomically with respect to other writers
        lock.writeLock().lock();
        try {
            checkCapacity(created.size());
            store(created);
            chunks.addAll(created);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Ingested document {} '{}' as {} chunk(s), index size {}",
                documentId, document.title(), created.size(), size());
        return created.stream().map(DocumentChunk::getChunkId).toList();
    }

    /**
     * Insert in bounded batches (SQLite caps bound variables per statement).
     * A failed batch removes the rows already written for this ingestion.
     */
    private void store(List<DocumentChunk> created) {
        List<String> stored = new ArrayList<>(created.size());
        try {
            for (List<DocumentChunk> batch : batches(created)) {
                mapper.insertAll(batch);
                batch.forEach(c -> stored.add(c.getChunkId()));
            }
        } catch (DataAccessException e) {
            discard(stored);
            throw new RetrievalUnavailableException("Chunk storage failed", e);
        }
    }

    private void discard(List<String> chunkIds) {
        for (List<String> batch : batches(chunkIds)) {
            try {
                mapper.deleteByChunkIds(batch);
            } catch (DataAccessException e) {
                log.error("Could not remove {} partially stored chunk(s); they reappear on restart", batch.size(), e);
            }
        }
    }

    private static <T> List<List<T>> batches(List<T> items) {
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += INSERT_BATCH_SIZE) {
            batches.add(items.subList(from, Math.min(items.size(), from + INSERT_BATCH_SIZE)));
        }
        return batches;
    }

    private void checkCapacity(int requested) {
        int max = properties.getRetrieval().getMaxIndexSize();
        int current = size();
        if (current + requested > max) {
            log.warn("Index capacity exceeded: {} + {} > {}", current, requested, max);
            throw new IndexCapacityExceededException(current, requested, max);
        }
    }

    /**
     * Top-k chunks by cosine similarity; ties go to the most recently ingested
     *
     * @throws RetrievalUnavailableException when the query cannot be embedded
     */
    public List<ScoredChunk> search(String query, int k) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        List<DocumentChunk> snapshot = snapshot();
        if (snapshot.isEmpty()) {
            return List.of();
        }

        Embedding queryVector;
        try {
            queryVector = retryPolicy.execute(OperationKind.EMBED,
                    () -> embeddingModel.embed(TextNormalizer.normalize(query)).content());
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException("Query embedding failed: " + e.getMessage(), e);
        }

        double minScore = properties.getRetrieval().getMinScore();
        List<ScoredChunk> scored = new ArrayList<>();
        for (DocumentChunk chunk : snapshot) {
            float[] vector = chunk.getEmbedding();
            if (vector == null || vector.length != queryVector.dimension()) {
                continue;
            }
            double score = CosineSimilarity.between(queryVector, Embedding.from(vector));
            if (!Double.isNaN(score) && score >= minScore) {
                scored.add(new ScoredChunk(chunk, score));
            }
        }
        scored.sort(RANKING);
        List<ScoredChunk> top = scored.stream()
                .limit(k)
                .map(hit -> new ScoredChunk(hit.chunk().copy(), hit.score()))
                .toList();
        log.debug("Search '{}' -> {} hit(s), best {}", TextNormalizer.truncate(query, 60), top.size(),
                top.isEmpty() ? "-" : String.format("%.3f", top.get(0).score()));
        return top;
    }

    /**
     * @return number of chunks removed
     */
    public int removeDocument(String documentId) {
        lock.writeLock().lock();
        try {
            int removed = mapper.deleteByDocumentId(documentId);
            chunks.removeIf(c -> documentId.equals(c.getDocumentId()));
            log.info("Removed document {} ({} chunk(s))", documentId, removed);
            return removed;
        } catch (DataAccessException e) {
            throw new RetrievalUnavailableException("Chunk removal failed for " + documentId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> stats() {
        List<DocumentChunk> snapshot = snapshot();
        Map<String, Long> bySource = snapshot.stream()
                .collect(Collectors.groupingBy(c -> c.getSource() == null ? "unknown" : c.getSource(),
                        TreeMap::new, Collectors.counting()));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalChunks", snapshot.size());
        stats.put("totalDocuments", snapshot.stream().map(DocumentChunk::getDocumentId).distinct().count());
        stats.put("maxIndexSize", properties.getRetrieval().getMaxIndexSize());
        stats.put("sources", bySource);
        stats.put("topics", snapshot.stream().flatMap(c -> c.topicList().stream())
                .collect(Collectors.toCollection(TreeSet::new)));
        stats.put("embeddingModel", properties.getAi().getEmbeddingModel());
        return stats;
    }

    private List<DocumentChunk> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(chunks);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Instant ingestedAt(DocumentChunk chunk) {
        if (chunk.getIngestedAt() == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(chunk.getIngestedAt());
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
