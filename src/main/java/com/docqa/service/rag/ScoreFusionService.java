package com.docqa.service.rag;

import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ScoredChunk;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Min-max normalizes lexical scores and blends them with semantic scores:
 * {@code combined = alpha * semantic + (1 - alpha) * lexical}.
 */
@Service
public class ScoreFusionService {

    public List<ScoredChunk> fuse(
            List<Chunk> chunks,
            Map<String, Double> lexical,
            Map<String, Double> semantic,
            double alpha
    ) {
        Map<String, Double> normalizedLexical = normalize(lexical);

        List<ScoredChunk> fused = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            double lexicalScore = lexical.getOrDefault(chunk.getId(), 0.0);
            double semanticScore = semantic.getOrDefault(chunk.getId(), 0.0);
            double lexicalNormalized = normalizedLexical.getOrDefault(chunk.getId(), 0.0);

            double combined = alpha * semanticScore + (1 - alpha) * lexicalNormalized;

            fused.add(ScoredChunk.builder()
                    .chunk(chunk)
                    .lexicalScore(lexicalScore)
                    .semanticScore(semanticScore)
                    .combinedScore(clamp(combined))
                    .build());
        }

        fused.sort(ScoredChunk.RANKING);
        return fused;
    }

    /**
     * All-equal scores normalize to 0 rather than dividing by zero.
     */
    Map<String, Double> normalize(Map<String, Double> scores) {
        Map<String, Double> normalized = new HashMap<>();
        if (scores.isEmpty()) {
            return normalized;
        }

        double min = Collections.min(scores.values());
        double max = Collections.max(scores.values());
        double range = max - min;

        scores.forEach((id, score) ->
                normalized.put(id, range == 0 ? 0.0 : (score - min) / range));
        return normalized;
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
