package com.ai.studyassistant.service;

import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.exception.RetrievalUnavailableException;
import com.ai.studyassistant.index.KnowledgeIndex;
import com.ai.studyassistant.model.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Retriever turns a query embedding into a ranked, de-duplicated list of
 * chunks from the {@link KnowledgeIndex}.
 *
 * <ol>
 * <li>Asks the index for the {@code k * candidate-multiplier} nearest chunks,
 * so that several documents survive de-duplication.</li>
 * <li>Drops every match below {@code minSimilarity}.</li>
 * <li>Orders by descending similarity (ties keep index order).</li>
 * <li>Keeps only the best chunk per source document, so one long document
 * cannot flood the prompt with near-duplicate passages.</li>
 * <li>Caps the result at {@code k}.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Retriever {

    private final KnowledgeIndex knowledgeIndex;
    private final RagProperties properties;

    /**
     * @param queryEmbedding embedding of the question
     * @param k              maximum number of results, at least 1
     * @param minSimilarity  matches scoring below this are excluded
     * @param courseId       optional course scope
     * @return results ordered by descending similarity, at most one per document
     * @throws RetrievalUnavailableException if the index cannot be queried
     */
    public List<RetrievalResult> retrieve(float[] queryEmbedding, int k, double minSimilarity, Long courseId) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        if (queryEmbedding == null || queryEmbedding.length == 0) {
            throw new IllegalArgumentException("Query embedding must not be empty");
        }

        int candidateCount = Math.max(k, k * properties.getRetrieval().getCandidateMultiplier());
        List<RetrievalResult> candidates;
        try {
            candidates = knowledgeIndex.search(queryEmbedding, candidateCount, courseId);
        } catch (RetrievalUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException("Knowledge index unavailable: " + e.getMessage(), e);
        }
        if (candidates == null || candidates.isEmpty()) {
            log.debug("Knowledge index returned no candidates (courseId={})", courseId);
            return List.of();
        }

        List<RetrievalResult> ranked = candidates.stream()
                .filter(r -> r != null && r.getChunk() != null)
                .filter(r -> r.getSimilarityScore() >= minSimilarity)
                .sorted(Comparator.comparingDouble(RetrievalResult::getSimilarityScore).reversed())
                .toList();

        Set<String> seenDocuments = new HashSet<>();
        List<RetrievalResult> results = new ArrayList<>();
        for (RetrievalResult result : ranked) {
            if (!seenDocuments.add(result.getChunk().documentKey())) {
                continue;
            }
            results.add(result);
            if (results.size() == k) {
                break;
            }
        }

        log.debug("Retrieved {} of {} candidates (minSimilarity={}, dropped by dedup or cap={})",
                results.size(), candidates.size(), minSimilarity, ranked.size() - results.size());
        return List.copyOf(results);
    }
}
