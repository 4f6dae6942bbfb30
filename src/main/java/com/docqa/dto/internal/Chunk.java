package com.docqa.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A span of extracted document text with its precomputed embedding.
 * Owned by the chunk store; read-only inside the pipeline.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Chunk {

    private String id;
    private String documentId;
    private String documentTitle;
    private int sequenceIndex;
    private Integer pageNumber;
    private String text;
    private List<Double> embedding;

    public int dimension() {
        return embedding != null ? embedding.size() : 0;
    }
}
