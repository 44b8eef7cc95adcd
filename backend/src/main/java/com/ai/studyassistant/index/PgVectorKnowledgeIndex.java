package com.ai.studyassistant.index;

import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.exception.RetrievalUnavailableException;
import com.ai.studyassistant.model.Chunk;
import com.ai.studyassistant.model.RetrievalResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * {@link KnowledgeIndex} over the pgvector table written by Spring AI's
 * {@code PgVectorStore} during ingestion.
 *
 * <p>
 * Columns used: {@code id}, {@code content}, {@code metadata} (json) and
 * {@code embedding} (vector). Chunk metadata keys are {@code document_id},
 * {@code title}, {@code category}, {@code offset} and {@code course_id}.
 * Similarity is {@code 1 - cosine distance}.
 * </p>
 */
@Slf4j
@Repository
public class PgVectorKnowledgeIndex implements KnowledgeIndex {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String tableName;

    public PgVectorKnowledgeIndex(NamedParameterJdbcTemplate jdbcTemplate,
                                  ObjectMapper objectMapper,
                                  RagProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.tableName = properties.getIndex().getTableName();
    }

    @Override
    public List<RetrievalResult> search(float[] queryEmbedding, int k, Long courseId) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, content, metadata::text AS metadata, embedding::text AS embedding,
                       embedding <=> CAST(:embedding AS vector) AS distance
                FROM %s
                WHERE 1=1
                """.formatted(tableName));

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("embedding", toVectorLiteral(queryEmbedding))
                .addValue("k", k);

        if (courseId != null) {
            sql.append(" AND metadata->>'course_id' = :courseId ");
            params.addValue("courseId", String.valueOf(courseId));
        }
        sql.append(" ORDER BY distance ASC LIMIT :k");

        try {
            List<RetrievalResult> results = jdbcTemplate.query(sql.toString(), params, this::mapRow);
            log.debug("pgvector search returned {} rows (k={}, courseId={})", results.size(), k, courseId);
            return results;
        } catch (DataAccessException e) {
            throw new RetrievalUnavailableException("Knowledge index query failed: " + e.getMessage(), e);
        }
    }

    RetrievalResult mapRow(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        JsonNode metadata = readMetadata(id, rs.getString("metadata"));

        Chunk chunk = Chunk.builder()
                .id(id)
                .text(rs.getString("content"))
                .embedding(readEmbedding(id, rs.getString("embedding")))
                .sourceDocumentId(textOrNull(metadata, "document_id"))
                .sourceTitle(metadata.path("title").asText(""))
                .sourceCategory(metadata.path("category").asText(""))
                .offset(metadata.path("offset").asInt(0))
                .build();

        double similarity = 1.0 - rs.getDouble("distance");
        return new RetrievalResult(chunk, similarity);
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private JsonNode readMetadata(String id, String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable metadata for chunk {}: {}", id, e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private float[] readEmbedding(String id, String literal) {
        if (literal == null || literal.isBlank()) {
            return null;
        }
        try {
            // pgvector prints vectors as "[0.1,0.2,...]", which is valid JSON
            return objectMapper.readValue(literal, float[].class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable embedding for chunk {}: {}", id, e.getOriginalMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }
}
