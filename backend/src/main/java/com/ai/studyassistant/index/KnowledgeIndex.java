package com.ai.studyassistant.index;

import com.ai.studyassistant.exception.RetrievalUnavailableException;
import com.ai.studyassistant.model.RetrievalResult;

import java.util.List;

/**
 * Read-only nearest-neighbour lookup over indexed chunks.
 */
public interface KnowledgeIndex {

    /**
     * Finds up to {@code k} chunks closest to {@code queryEmbedding}.
     *
     * @param queryEmbedding embedding of the question
     * @param k              maximum number of matches
     * @param courseId       restricts matches to one course; {@code null} searches everything
     * @return matches with their similarity; order is not guaranteed
     * @throws RetrievalUnavailableException if the index cannot be queried
     */
    List<RetrievalResult> search(float[] queryEmbedding, int k, Long courseId);
}
