package com.ai.studyassistant.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response body for POST /api/learning/ask, the non-streaming answer path.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AskQuestionResponse {

    /** The LLM-generated answer. */
    private String answer;

    /** Only the sources the answer actually drew on. */
    private List<SourceDto> sources;

    /**
     * Best similarity among the top retrieved chunks; absent when the answer
     * came from general knowledge.
     */
    private Double confidence;
}
