package com.ai.studyassistant.dto;

import com.ai.studyassistant.model.ConversationTurn;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/learning/ask-stream and POST /api/learning/ask
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskQuestionRequest {

    @NotBlank(message = "Question must not be blank")
    @Size(max = 1000, message = "Question must be at most 1000 characters")
    private String question;

    /** Restricts retrieval to one course's material when present. */
    @JsonProperty("course_id")
    private Long courseId;

    /** Earlier turns of the conversation, oldest first. */
    @Size(max = 20, message = "At most 20 history turns are accepted")
    @Builder.Default
    private List<@NotNull(message = "History turns must not be null") @Valid ConversationTurn> history = new ArrayList<>();
}
