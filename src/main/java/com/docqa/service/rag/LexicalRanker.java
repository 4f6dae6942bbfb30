package com.docqa.service.rag;

import com.docqa.config.ModelConfig;
import com.docqa.dto.internal.Chunk;
import com.docqa.util.Tokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Okapi BM25 over the candidate chunk set of a single query.
 * The candidate set is the reference corpus, so document frequencies are rebuilt per call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LexicalRanker {

    private final Tokenizer tokenizer;
    private final ModelConfig modelConfig;

    /**
     * Scores every chunk, including non-matching ones (score 0), keyed by chunk id
     * in candidate order.
     */
    public Map<String, Double> score(String query, List<Chunk> chunks) {
        long startTime = System.nanoTime();

        Map<String, Double> scores = new LinkedHashMap<>();
        if (chunks == null || chunks.isEmpty()) {
            return scores;
        }

        BM25Index index = buildIndex(chunks);
        List<String> queryTerms = tokenizer.tokenize(query);

        for (DocumentData doc : index.corpus) {
            scores.put(doc.chunkId, calculateBM25Score(queryTerms, doc, index));
        }

        long duration = (System.nanoTime() - startTime) / 1_000_000;
        log.debug("BM25 scored {} chunks against {} query terms in {}ms",
                scores.size(), queryTerms.size(), duration);

        return scores;
    }

    private BM25Index buildIndex(List<Chunk> chunks) {
        BM25Index index = new BM25Index();
        long totalTokens = 0;

        for (Chunk chunk : chunks) {
            List<String> tokens = tokenizer.tokenize(chunk.getText());
            Map<String, Integer> termFreq = calculateTermFreq(tokens);

            index.corpus.add(new DocumentData(chunk.getId(), tokens.size(), termFreq));
            totalTokens += tokens.size();

            for (String term : termFreq.keySet()) {
                index.docFreq.merge(term, 1, Integer::sum);
            }
        }

        index.avgDocLength = (double) totalTokens / index.corpus.size();
        return index;
    }

    private double calculateBM25Score(List<String> queryTerms, DocumentData doc, BM25Index index) {
        if (index.avgDocLength == 0) {
            return 0.0;
        }

        double k1 = modelConfig.getK1();
        double b = modelConfig.getB();
        int numDocs = index.corpus.size();
        double score = 0.0;

        for (String term : queryTerms) {
            int tf = doc.termFreq.getOrDefault(term, 0);
            if (tf == 0) continue;

            int df = index.docFreq.getOrDefault(term, 0);

            double idf = Math.log((numDocs - df + 0.5) / (df + 0.5) + 1.0);
            double numerator = tf * (k1 + 1);
            double denominator = tf + k1 * (1 - b + b * doc.length / index.avgDocLength);

            score += idf * (numerator / denominator);
        }
        return score;
    }

    private Map<String, Integer> calculateTermFreq(List<String> tokens) {
        Map<String, Integer> termFreq = new HashMap<>();
        for (String token : tokens) {
            termFreq.merge(token, 1, Integer::sum);
        }
        return termFreq;
    }

    private static class BM25Index {
        List<DocumentData> corpus = new ArrayList<>();
        Map<String, Integer> docFreq = new HashMap<>();
        double avgDocLength;
    }

    private static class DocumentData {
        String chunkId;
        int length;
        Map<String, Integer> termFreq;

        DocumentData(String chunkId, int length, Map<String, Integer> termFreq) {
            this.chunkId = chunkId;
            this.length = length;
            this.termFreq = termFreq;
        }
    }
}
