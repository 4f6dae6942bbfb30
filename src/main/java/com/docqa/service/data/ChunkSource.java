package com.docqa.service.data;

import com.docqa.dto.internal.Chunk;
import com.docqa.dto.internal.ChunkFilter;
import com.docqa.dto.internal.DocumentRef;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the chunk store.
 */
public interface ChunkSource {

    /**
     * Chunks of READY documents, ordered by document id then sequence index.
     * The returned list is an immutable snapshot.
     */
    List<Chunk> listReadyChunks(ChunkFilter filter);

    Optional<DocumentRef> findDocument(String documentId);
}
