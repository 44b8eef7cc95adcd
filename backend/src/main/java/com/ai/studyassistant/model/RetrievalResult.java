package com.ai.studyassistant.model;

import lombok.Value;

/**
 * A chunk matched for one query, with its similarity to the query embedding.
 */
@Value
public class RetrievalResult {

    Chunk chunk;

    double similarityScore;
}
