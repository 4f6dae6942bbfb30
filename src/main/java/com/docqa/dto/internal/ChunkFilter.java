package com.docqa.dto.internal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChunkFilter {

    private static final ChunkFilter ALL = ChunkFilter.builder().build();

    // null means every ready document
    String documentId;

    public static ChunkFilter all() {
        return ALL;
    }

    public static ChunkFilter forDocument(String documentId) {
        return ChunkFilter.builder().documentId(documentId).build();
    }

    public boolean matches(Chunk chunk) {
        return documentId == null || documentId.equals(chunk.getDocumentId());
    }
}
