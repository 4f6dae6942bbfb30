package com.docqa.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoredChunk {

    /**
     * Descending combined score, then ascending (documentId, sequenceIndex).
     */
    public static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::getCombinedScore).reversed()
            .thenComparing(ScoredChunk::getDocumentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(ScoredChunk::getSequenceIndex);

    private Chunk chunk;

    // raw BM25 score, >= 0
    private double lexicalScore;

    // cosine similarity rescaled to [0, 1]
    private double semanticScore;

    private double combinedScore;

    public String getChunkId() {
        return chunk.getId();
    }

    public String getDocumentId() {
        return chunk.getDocumentId();
    }

    public String getDocumentTitle() {
        return chunk.getDocumentTitle();
    }

    public int getSequenceIndex() {
        return chunk.getSequenceIndex();
    }

    public Integer getPageNumber() {
        return chunk.getPageNumber();
    }

    public String getText() {
        return chunk.getText();
    }
}
