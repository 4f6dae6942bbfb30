package com.docqa.service.rag;

import com.docqa.dto.internal.Chunk;
import com.docqa.exception.DimensionMismatchException;
import com.docqa.exception.RetrievalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine similarity between the query embedding and each chunk embedding,
 * rescaled from [-1, 1] to [0, 1].
 */
@Slf4j
@Service
public class SemanticRanker {

    public Map<String, Double> score(List<Double> queryEmbedding, List<Chunk> chunks) {
        if (queryEmbedding == null || queryEmbedding.isEmpty()) {
            throw new RetrievalException("Query embedding is empty");
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (Chunk chunk : chunks) {
            double similarity = cosineSimilarity(queryEmbedding, chunk.getEmbedding());
            scores.put(chunk.getId(), rescale(similarity));
        }
        return scores;
    }

    /**
     * @throws DimensionMismatchException when the vectors differ in length
     */
    public double cosineSimilarity(List<Double> a, List<Double> b) {
        int actual = b != null ? b.size() : 0;
        if (a.size() != actual) {
            throw new DimensionMismatchException(a.size(), actual);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dotProduct += x * y;
            normA += x * x;
            normB += y * y;
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double similarity = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    static double rescale(double similarity) {
        return (similarity + 1.0) / 2.0;
    }
}
