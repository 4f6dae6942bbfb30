package com.docqa.service.rag;

import com.docqa.config.ModelConfig;
import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ScoredChunk;
import com.docqa.exception.DimensionMismatchException;
import com.docqa.exception.InvalidArgumentException;
import com.docqa.service.embedding.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Hybrid lexical + semantic ranking over a caller-supplied snapshot of ready chunks.
 *
 * <p>Pipeline: validate candidates, embed the query, BM25 + cosine scoring,
 * score fusion, diversity rerank. The chunk list is never cached or mutated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridRetriever {

    private final EmbeddingProvider embeddingProvider;
    private final LexicalRanker lexicalRanker;
    private final SemanticRanker semanticRanker;
    private final ScoreFusionService scoreFusionService;
    private final DiversityReranker diversityReranker;
    private final ModelConfig modelConfig;

    public List<ScoredChunk> retrieve(String query, List<Chunk> chunks, int topK) {
        return retrieve(query, chunks, topK, modelConfig.getAlpha());
    }

    /**
     * @throws com.docqa.exception.RetrievalException when the query cannot be embedded
     * @throws DimensionMismatchException when no candidate shares the query embedding dimension
     */
    public List<ScoredChunk> retrieve(String query, List<Chunk> chunks, int topK, double alpha) {
        validate(topK, alpha);

        List<Chunk> candidates = wellFormed(chunks);
        if (candidates.isEmpty()) {
            log.info("No candidate chunks to rank");
            return List.of();
        }

        List<Double> queryEmbedding = embeddingProvider.embed(query);
        return rank(query, queryEmbedding, candidates, topK, alpha);
    }

    private List<ScoredChunk> rank(String query, List<Double> queryEmbedding,
                                   List<Chunk> candidates, int topK, double alpha) {
        List<Chunk> comparable = matchingDimension(candidates, queryEmbedding.size());
        if (comparable.isEmpty()) {
            log.error("No chunk shares the query embedding dimension {}", queryEmbedding.size());
            throw new DimensionMismatchException(queryEmbedding.size(), candidates.get(0).dimension());
        }

        Map<String, Double> lexical = lexicalRanker.score(query, comparable);
        Map<String, Double> semantic = semanticRanker.score(queryEmbedding, comparable);

        List<ScoredChunk> fused = scoreFusionService.fuse(comparable, lexical, semantic, alpha);

        int cap = modelConfig.getMaxChunksPerDocument(topK);
        List<ScoredChunk> results = diversityReranker.rerank(fused, topK, cap);

        log.info("Retrieved {} of {} candidates (alpha={}, cap={})",
                results.size(), comparable.size(), alpha, cap);
        return results;
    }

    private void validate(int topK, double alpha) {
        if (topK < 1) {
            throw new InvalidArgumentException("topK must be positive, got " + topK);
        }
        if (alpha < 0.0 || alpha > 1.0) {
            throw new InvalidArgumentException("alpha must be within [0, 1], got " + alpha);
        }
    }

    /**
     * Drops chunks with blank text or no embedding, and repeated chunk ids.
     */
    private List<Chunk> wellFormed(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }

        Set<String> seen = new HashSet<>();
        List<Chunk> valid = new ArrayList<>(chunks.size());
        int skipped = 0;

        for (Chunk chunk : chunks) {
            if (chunk.getText() == null || chunk.getText().isBlank()
                    || chunk.getEmbedding() == null || chunk.getEmbedding().isEmpty()) {
                log.warn("Excluding malformed chunk {} of document {}", chunk.getId(), chunk.getDocumentId());
                skipped++;
                continue;
            }
            if (!seen.add(chunk.getId())) {
                log.warn("Excluding duplicate chunk id {}", chunk.getId());
                skipped++;
                continue;
            }
            valid.add(chunk);
        }

        if (skipped > 0) {
            log.info("Excluded {} of {} candidate chunks", skipped, chunks.size());
        }
        return valid;
    }

    private List<Chunk> matchingDimension(List<Chunk> chunks, int dimension) {
        List<Chunk> matching = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            if (chunk.dimension() != dimension) {
                log.warn("Excluding chunk {}: embedding dimension {} != query dimension {}",
                        chunk.getId(), chunk.dimension(), dimension);
                continue;
            }
            matching.add(chunk);
        }
        return matching;
    }
}
