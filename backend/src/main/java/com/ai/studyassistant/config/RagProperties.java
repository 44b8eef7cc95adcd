package com.ai.studyassistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs for retrieval, prompt composition, generation and attribution.
 * Bound from the {@code rag.*} keys in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    private Retrieval retrieval = new Retrieval();
    private Prompt prompt = new Prompt();
    private Generation generation = new Generation();
    private Attribution attribution = new Attribution();
    private Sources sources = new Sources();
    private Index index = new Index();

    @Data
    public static class Retrieval {

        /** Number of nearest chunks requested from the index. */
        private int topK = 5;

        /**
         * Rows fetched from the index per requested result. Several chunks of one
         * document collapse into one, so asking for exactly {@code topK} rows can
         * leave fewer distinct documents than are available.
         */
        private int candidateMultiplier = 3;

        /** Chunks scoring below this similarity are dropped, not returned as noise. */
        private double minSimilarity = 0.5;

        /** Bound on embedding the question plus the index lookup. */
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Prompt {

        /** Maximum length, in characters, of the fully rendered prompt. */
        private int budgetChars = 6000;

        private Duration timeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Generation {

        /** Time allowed for the model to produce its first non-empty fragment. */
        private Duration firstFragmentTimeout = Duration.ofSeconds(20);

        /** Overall deadline for a streamed answer, measured from subscription. */
        private Duration timeout = Duration.ofSeconds(120);

        /** Deadline for the non-streaming model call. */
        private Duration syncTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Attribution {

        private int ngramSize = 3;

        /** Shared n-grams needed before a chunk counts as used by the answer. */
        private int minSharedNgrams = 2;
    }

    @Data
    public static class Sources {

        private int snippetLength = 200;
    }

    @Data
    public static class Index {

        /** pgvector table maintained by the ingestion side. */
        private String tableName = "vector_store";
    }
}
