package com.ai.studyassistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The composed model input for one question.
 *
 * <p>
 * {@code selectedChunks} keeps rank order; position {@code i} is cited in the
 * prompt as {@code [i + 1]}. {@code renderedPrompt} never exceeds the budget it
 * was composed for.
 * </p>
 */
@Value
@Builder
public class PromptContext {

    String question;

    @Singular
    List<RetrievalResult> selectedChunks;

    @Singular("historyTurn")
    List<ConversationTurn> history;

    String renderedPrompt;

    public boolean hasContext() {
        return !selectedChunks.isEmpty();
    }

    /** Citation marker number for the chunk at the given position. */
    public static int markerFor(int position) {
        return position + 1;
    }
}
