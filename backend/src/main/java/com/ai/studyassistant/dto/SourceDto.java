package com.ai.studyassistant.dto;

import com.ai.studyassistant.model.Chunk;
import com.ai.studyassistant.model.RetrievalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A source chip shown next to an answer: which document, a short excerpt,
 * and the document's category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDto {

    private String title;

    private String snippet;

    private String category;

    public static SourceDto from(RetrievalResult result, int snippetLength) {
        Chunk chunk = result.getChunk();
        return SourceDto.builder()
                .title(chunk.getSourceTitle())
                .snippet(snippet(chunk.getText(), snippetLength))
                .category(chunk.getSourceCategory())
                .build();
    }

    private static String snippet(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        return trimmed.substring(0, maxChars) + "...";
    }
}
