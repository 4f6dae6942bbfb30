package com.docqa.service.rag;

import com.docqa.dto.internal.ScoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Keeps one document from monopolizing the answer context.
 */
@Slf4j
@Service
public class DiversityReranker {

    /**
     * Selects up to {@code topK} chunks from an already ranked list, skipping chunks whose
     * document already holds {@code maxPerDocument} slots. Backfills from the skipped
     * candidates, ignoring the cap, when the capped pass comes up short.
     */
    public List<ScoredChunk> rerank(List<ScoredChunk> ranked, int topK, int maxPerDocument) {
        log.debug("Diversity rerank of {} candidates to top {} (cap {})", ranked.size(), topK, maxPerDocument);

        if (ranked.isEmpty()) {
            return List.of();
        }

        List<ScoredChunk> selected = new ArrayList<>();
        List<ScoredChunk> skipped = new ArrayList<>();
        Map<String, Integer> perDocument = new HashMap<>();

        for (ScoredChunk candidate : ranked) {
            if (selected.size() >= topK) {
                break;
            }

            int taken = perDocument.getOrDefault(candidate.getDocumentId(), 0);
            if (taken >= maxPerDocument) {
                skipped.add(candidate);
                continue;
            }

            selected.add(candidate);
            perDocument.put(candidate.getDocumentId(), taken + 1);
        }

        if (selected.size() < topK) {
            // the walk covered every candidate, so skipped is complete and in rank order
            int backfill = Math.min(topK - selected.size(), skipped.size());
            selected.addAll(skipped.subList(0, backfill));
            log.debug("Backfilled {} chunks past the per-document cap", backfill);
        }

        selected.sort(ScoredChunk.RANKING);
        return selected;
    }
}
