package com.ai.studyassistant.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One earlier message of the conversation, sent along with a question so
 * follow-ups ("and what about the second one?") can be understood.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    @NotBlank
    @Pattern(regexp = "user|assistant", message = "role must be 'user' or 'assistant'")
    private String role;

    @NotBlank
    private String content;
}
