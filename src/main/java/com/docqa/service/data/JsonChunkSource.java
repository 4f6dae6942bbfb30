package com.docqa.service.data;

import com.docqa.config.DatasetConfig;
import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ChunkFilter;
import com.docqa.dto.internal.DocumentRef;
import com.docqa.dto.internal.DocumentStatus;
import com.docqa.exception.RagException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Chunk store backed by a JSON file of documents with their embedded chunks.
 *
 * <p>Readers always see one complete snapshot; {@link #reload()} swaps it atomically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JsonChunkSource implements ChunkSource {

    private static final Comparator<Chunk> STORE_ORDER = Comparator
            .comparing(Chunk::getDocumentId)
            .thenComparingInt(Chunk::getSequenceIndex);

    private final DatasetConfig datasetConfig;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private volatile CorpusSnapshot snapshot = CorpusSnapshot.EMPTY;

    @Override
    public List<Chunk> listReadyChunks(ChunkFilter filter) {
        CorpusSnapshot current = snapshot;
        ChunkFilter effective = filter != null ? filter : ChunkFilter.all();

        return current.readyChunks.stream()
                .filter(effective::matches)
                .toList();
    }

    @Override
    public Optional<DocumentRef> findDocument(String documentId) {
        return Optional.ofNullable(snapshot.documents.get(documentId));
    }

    /**
     * Re-reads the store file. A missing file yields an empty corpus.
     */
    public synchronized void reload() {
        Path path = Paths.get(datasetConfig.getChunks()).toAbsolutePath();
        log.info("Loading chunk store from: {}", path);

        if (!Files.exists(path)) {
            log.warn("Chunk store not found: {} - no documents are ready", path);
            snapshot = CorpusSnapshot.EMPTY;
            return;
        }

        try {
            List<StoredDocument> documents = objectMapper.readValue(
                    path.toFile(),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, StoredDocument.class)
            );
            snapshot = buildSnapshot(documents);

            log.info("Chunk store loaded: {} documents, {} ready chunks",
                    snapshot.documents.size(), snapshot.readyChunks.size());

        } catch (Exception e) {
            log.error("Failed to load chunk store: {}", e.getMessage(), e);
            throw new RagException("Failed to load chunk store " + path, e);
        }
    }

    public Map<String, Object> getStatistics() {
        CorpusSnapshot current = snapshot;
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("documents", current.documents.size());
        stats.put("readyDocuments", current.documents.values().stream().filter(DocumentRef::isReady).count());
        stats.put("readyChunks", current.readyChunks.size());
        stats.put("path", datasetConfig.getChunks());
        return stats;
    }

    private CorpusSnapshot buildSnapshot(List<StoredDocument> documents) {
        Map<String, DocumentRef> refs = new LinkedHashMap<>();
        List<Chunk> ready = new ArrayList<>();

        for (StoredDocument doc : documents) {
            if (doc.getId() == null) {
                log.warn("Skipping document without id");
                continue;
            }

            DocumentStatus status = doc.getStatus() != null ? doc.getStatus() : DocumentStatus.UPLOADED;
            refs.put(doc.getId(), DocumentRef.builder()
                    .id(doc.getId())
                    .title(doc.getTitle())
                    .status(status)
                    .build());

            if (status != DocumentStatus.READY || doc.getChunks() == null) {
                continue;
            }

            Set<Integer> sequenceIndexes = new HashSet<>();
            for (StoredChunk stored : doc.getChunks()) {
                if (!sequenceIndexes.add(stored.getSequenceIndex())) {
                    log.warn("Duplicate sequence index {} in document {} - keeping first",
                            stored.getSequenceIndex(), doc.getId());
                    continue;
                }
                ready.add(toChunk(doc, stored));
            }
        }

        ready.sort(STORE_ORDER);
        return new CorpusSnapshot(Collections.unmodifiableMap(refs), List.copyOf(ready));
    }

    private Chunk toChunk(StoredDocument doc, StoredChunk stored) {
        String id = stored.getId() != null
                ? stored.getId()
                : doc.getId() + "_" + stored.getSequenceIndex();

        return Chunk.builder()
                .id(id)
                .documentId(doc.getId())
                .documentTitle(doc.getTitle())
                .sequenceIndex(stored.getSequenceIndex())
                .pageNumber(stored.getPageNumber())
                .text(stored.getText())
                .embedding(stored.getEmbedding() != null ? List.copyOf(stored.getEmbedding()) : null)
                .build();
    }

    private static final class CorpusSnapshot {
        static final CorpusSnapshot EMPTY = new CorpusSnapshot(Map.of(), List.of());

        final Map<String, DocumentRef> documents;
        final List<Chunk> readyChunks;

        CorpusSnapshot(Map<String, DocumentRef> documents, List<Chunk> readyChunks) {
            this.documents = documents;
            this.readyChunks = readyChunks;
        }
    }

    @Data
    static class StoredDocument {
        private String id;
        private String title;
        private DocumentStatus status;
        private List<StoredChunk> chunks;
    }

    @Data
    static class StoredChunk {
        private String id;
        private int sequenceIndex;
        private Integer pageNumber;
        private String text;
        private List<Double> embedding;
    }
}
