package com.ai.studyassistant.model;

import lombok.Builder;
import lombok.Value;

/**
 * A bounded span of source-document text stored in the knowledge index
 * together with its embedding. Chunks are created at ingestion time and
 * never mutated afterwards.
 */
@Value
@Builder
public class Chunk {

    String id;

    String text;

    /** May be null when the index does not return vectors with matches. */
    float[] embedding;

    String sourceDocumentId;

    String sourceTitle;

    String sourceCategory;

    /** Character offset of this chunk within its source document. */
    int offset;

    /** A copy; the chunk's own vector cannot be changed through it. */
    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * Key used when collapsing several chunks of one document. Falls back to
     * the chunk id for chunks ingested without a document id.
     */
    public String documentKey() {
        return sourceDocumentId != null && !sourceDocumentId.isBlank() ? sourceDocumentId : id;
    }

    public static class ChunkBuilder {

        public ChunkBuilder embedding(float[] embedding) {
            this.embedding = embedding == null ? null : embedding.clone();
            return this;
        }
    }
}
