package com.ai.studyassistant.service;

import com.ai.studyassistant.exception.PromptBudgetExceededException;
import com.ai.studyassistant.model.Chunk;
import com.ai.studyassistant.model.ConversationTurn;
import com.ai.studyassistant.model.PromptContext;
import com.ai.studyassistant.model.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PromptComposer builds the grounded prompt for one question.
 *
 * <h2>Budget rule</h2>
 * Retrieved chunks are accepted greedily in rank order until the next one
 * would push the rendered prompt past the budget; that chunk and everything
 * after it are dropped. Chunks are never cut mid-text, and an accepted chunk is
 * never evicted for a later one. History is added afterwards, newest turn
 * first, and older turns that do not fit are left out.
 *
 * <h2>Citation convention</h2>
 * Each chunk appears as a numbered block {@code [n] 《title》 (category)}. The
 * model is asked to cite with {@code [n]} and to close with a
 * {@code Sources: 《title》} line, which is what attribution looks for.
 */
@Slf4j
@Service
public class PromptComposer {

    private static final String GROUNDED_TEMPLATE = """
            You are a friendly, knowledgeable study assistant. Answer the student's question
            using the course material below.

            Rules:
            - Be clear and concise; use bullet points when the answer has several parts.
            - When you use a passage, cite it inline with its number, e.g. [1].
            - If you used course material, finish with a new line: Sources: 《title》, 《title》
            - If the material does not cover the question, say so and answer from general knowledge
              without citing anything.
            - Do NOT invent sources.

            --- COURSE MATERIAL ---
            %s
            --- END OF COURSE MATERIAL ---
            %s
            STUDENT QUESTION: %s

            ANSWER:
            """;

    private static final String GENERAL_TEMPLATE = """
            You are a friendly, knowledgeable study assistant. No course material matched this
            question, so answer from your general knowledge. Do not cite sources and do not ask the
            student to provide material.
            %s
            STUDENT QUESTION: %s

            ANSWER:
            """;

    /**
     * Composes the prompt for {@code question}.
     *
     * @param question the student's question, never truncated
     * @param results  retrieval results in descending similarity order
     * @param history  earlier turns, oldest first; may be {@code null}
     * @param budget   maximum rendered prompt length in characters
     * @return the composed context; {@code hasContext()} is false when no chunk fit
     * @throws PromptBudgetExceededException if the question alone does not fit
     */
    public PromptContext compose(String question, List<RetrievalResult> results,
                                 List<ConversationTurn> history, int budget) {
        List<RetrievalResult> accepted = new ArrayList<>();
        for (RetrievalResult candidate : results == null ? List.<RetrievalResult>of() : results) {
            accepted.add(candidate);
            if (render(question, accepted, List.of()).length() > budget) {
                accepted.remove(accepted.size() - 1);
                log.debug("Prompt budget reached: accepted {} of {} chunks", accepted.size(), results.size());
                break;
            }
        }

        String bare = render(question, accepted, List.of());
        if (bare.length() > budget) {
            throw new PromptBudgetExceededException(bare.length(), budget);
        }

        List<ConversationTurn> keptHistory = fitHistory(question, accepted, history, budget);
        String prompt = render(question, accepted, keptHistory);

        if (accepted.isEmpty()) {
            log.debug("No chunks accepted; composing a general-knowledge prompt");
        }
        log.debug("Composed prompt: chunks={}, historyTurns={}, length={}/{}",
                accepted.size(), keptHistory.size(), prompt.length(), budget);

        return PromptContext.builder()
                .question(question)
                .selectedChunks(accepted)
                .history(keptHistory)
                .renderedPrompt(prompt)
                .build();
    }

    /** A prompt without course material or history. */
    public PromptContext composeGeneralKnowledge(String question, int budget) {
        return compose(question, List.of(), List.of(), budget);
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private List<ConversationTurn> fitHistory(String question, List<RetrievalResult> accepted,
                                              List<ConversationTurn> history, int budget) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ConversationTurn> kept = new ArrayList<>();
        for (int i = history.size() - 1; i >= 0; i--) {
            kept.add(0, history.get(i));
            if (render(question, accepted, kept).length() > budget) {
                kept.remove(0);
                log.debug("Dropped {} oldest history turns to fit the budget", i + 1);
                break;
            }
        }
        return Collections.unmodifiableList(kept);
    }

    private String render(String question, List<RetrievalResult> chunks, List<ConversationTurn> history) {
        String historyBlock = renderHistory(history);
        if (chunks.isEmpty()) {
            return GENERAL_TEMPLATE.formatted(historyBlock, question);
        }
        return GROUNDED_TEMPLATE.formatted(renderChunks(chunks), historyBlock, question);
    }

    private String renderChunks(List<RetrievalResult> chunks) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i).getChunk();
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append('[').append(PromptContext.markerFor(i)).append("] 《")
                    .append(chunk.getSourceTitle()).append('》');
            if (chunk.getSourceCategory() != null && !chunk.getSourceCategory().isBlank()) {
                sb.append(" (").append(chunk.getSourceCategory()).append(')');
            }
            sb.append('\n').append(chunk.getText());
        }
        return sb.toString();
    }

    private String renderHistory(List<ConversationTurn> history) {
        if (history.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n--- CONVERSATION SO FAR ---\n");
        for (ConversationTurn turn : history) {
            sb.append("assistant".equals(turn.getRole()) ? "ASSISTANT: " : "STUDENT: ")
                    .append(turn.getContent())
                    .append('\n');
        }
        return sb.append("--- END OF CONVERSATION ---\n").toString();
    }
}
