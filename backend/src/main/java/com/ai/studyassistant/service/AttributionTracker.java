package com.ai.studyassistant.service;

import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.model.Chunk;
import com.ai.studyassistant.model.PromptContext;
import com.ai.studyassistant.model.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AttributionTracker decides which prompt chunks an answer actually used.
 *
 * <p>
 * A chunk is kept only if it was part of the composed prompt and at least one
 * of these links it to the answer:
 * </p>
 * <ul>
 * <li>a citation marker {@code [n]} (or a list such as {@code [1, 3]});</li>
 * <li>its title written as {@code 《title》}, the form of the closing
 * "Sources:" line;</li>
 * <li>enough shared word n-grams between chunk text and answer.</li>
 * </ul>
 * When nothing qualifies the result is empty. Attribution is never guessed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttributionTracker {

    private static final Pattern CITATION = Pattern.compile("\\[\\s*(\\d+(?:\\s*,\\s*\\d+)*)\\s*]");

    private final RagProperties properties;

    /**
     * @param context the composed prompt the answer was generated from
     * @param answer  the full answer text
     * @return the used chunks, a subset of {@code context.getSelectedChunks()}
     *         in prompt order
     */
    public List<RetrievalResult> finalizeSources(PromptContext context, String answer) {
        if (context == null || !context.hasContext() || answer == null || answer.isBlank()) {
            return List.of();
        }

        int ngramSize = properties.getAttribution().getNgramSize();
        int minShared = properties.getAttribution().getMinSharedNgrams();

        Set<Integer> cited = citedMarkers(answer);
        Set<String> answerNgrams = ngrams(tokenize(answer), ngramSize);

        List<RetrievalResult> selected = context.getSelectedChunks();
        List<RetrievalResult> used = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            RetrievalResult result = selected.get(i);
            Chunk chunk = result.getChunk();
            if (cited.contains(PromptContext.markerFor(i))
                    || namesTitle(answer, chunk)
                    || sharedNgrams(answerNgrams, chunk.getText(), ngramSize) >= minShared) {
                used.add(result);
            }
        }

        if (used.isEmpty()) {
            log.debug("Attribution ambiguous: none of {} prompt chunks linked to the answer", selected.size());
        } else {
            log.debug("Attributed {} of {} prompt chunks", used.size(), selected.size());
        }
        return List.copyOf(used);
    }

    // ── Heuristics ──────────────────────────────────────────────────────────

    static Set<Integer> citedMarkers(String answer) {
        Set<Integer> markers = new HashSet<>();
        Matcher m = CITATION.matcher(answer);
        while (m.find()) {
            for (String number : m.group(1).split(",")) {
                try {
                    markers.add(Integer.parseInt(number.trim()));
                } catch (NumberFormatException e) {
                    // numbers too large to be a marker
                    log.trace("Ignoring citation marker '{}'", number);
                }
            }
        }
        return markers;
    }

    private static boolean namesTitle(String answer, Chunk chunk) {
        String title = chunk.getSourceTitle();
        return title != null && !title.isBlank() && answer.contains("《" + title.strip() + "》");
    }

    private static int sharedNgrams(Set<String> answerNgrams, String chunkText, int n) {
        if (answerNgrams.isEmpty() || chunkText == null) {
            return 0;
        }
        int shared = 0;
        for (String gram : ngrams(tokenize(chunkText), n)) {
            if (answerNgrams.contains(gram)) {
                shared++;
            }
        }
        return shared;
    }

    /**
     * Lower-cased letter/digit runs; every Han ideograph is a token of its own
     * since Chinese text has no spaces between words.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        text.codePoints().forEach(cp -> {
            if (Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN) {
                flush(word, tokens);
                tokens.add(new String(Character.toChars(cp)));
            } else if (Character.isLetterOrDigit(cp)) {
                word.appendCodePoint(Character.toLowerCase(cp));
            } else {
                flush(word, tokens);
            }
        });
        flush(word, tokens);
        return tokens;
    }

    static Set<String> ngrams(List<String> tokens, int n) {
        Set<String> grams = new HashSet<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            grams.add(String.join(" ", tokens.subList(i, i + n)));
        }
        return grams;
    }

    private static void flush(StringBuilder word, List<String> tokens) {
        if (word.length() > 0) {
            tokens.add(word.toString());
            word.setLength(0);
        }
    }
}
