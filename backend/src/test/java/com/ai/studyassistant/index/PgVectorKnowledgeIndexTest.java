package com.ai.studyassistant.index;

import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.exception.RetrievalUnavailableException;
import com.ai.studyassistant.model.RetrievalResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PgVectorKnowledgeIndexTest {

    private NamedParameterJdbcTemplate jdbcTemplate;
    private PgVectorKnowledgeIndex index;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(NamedParameterJdbcTemplate.class);
        index = new PgVectorKnowledgeIndex(jdbcTemplate, new ObjectMapper(), new RagProperties());
    }

    @Test
    void mapsRowMetadataAndConvertsDistanceToSimilarity() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("chunk-1");
        when(rs.getString("content")).thenReturn("A binary heap is a complete binary tree.");
        when(rs.getString("metadata")).thenReturn(
                "{\"document_id\":\"doc-9\",\"title\":\"Heaps\",\"category\":\"lecture\",\"offset\":3,\"course_id\":\"12\"}");
        when(rs.getString("embedding")).thenReturn("[0.25,0.5,-1.0]");
        when(rs.getDouble("distance")).thenReturn(0.18);

        RetrievalResult result = index.mapRow(rs, 0);

        assertThat(result.getSimilarityScore()).isCloseTo(0.82, within(1e-9));
        assertThat(result.getChunk().getId()).isEqualTo("chunk-1");
        assertThat(result.getChunk().getSourceDocumentId()).isEqualTo("doc-9");
        assertThat(result.getChunk().getSourceTitle()).isEqualTo("Heaps");
        assertThat(result.getChunk().getSourceCategory()).isEqualTo("lecture");
        assertThat(result.getChunk().getOffset()).isEqualTo(3);
        assertThat(result.getChunk().getEmbedding()).containsExactly(0.25f, 0.5f, -1.0f);
    }

    @Test
    void toleratesMissingMetadataAndEmbedding() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("chunk-2");
        when(rs.getString("content")).thenReturn("Orphan text.");
        when(rs.getString("metadata")).thenReturn("not json");
        when(rs.getString("embedding")).thenReturn(null);
        when(rs.getDouble("distance")).thenReturn(0.5);

        RetrievalResult result = index.mapRow(rs, 0);

        assertThat(result.getChunk().getSourceDocumentId()).isNull();
        assertThat(result.getChunk().getSourceTitle()).isEmpty();
        assertThat(result.getChunk().getEmbedding()).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void filtersByCourseWhenOneIsGiven() {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        index.search(new float[] { 0.1f, 0.2f }, 4, 12L);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).query(sql.capture(), params.capture(), any(RowMapper.class));

        assertThat(sql.getValue())
                .contains("FROM vector_store")
                .contains("metadata->>'course_id' = :courseId")
                .contains("ORDER BY distance ASC LIMIT :k");
        assertThat(params.getValue().getValue("courseId")).isEqualTo("12");
        assertThat(params.getValue().getValue("k")).isEqualTo(4);
        assertThat(params.getValue().getValue("embedding")).isEqualTo("[0.1,0.2]");
    }

    @Test
    @SuppressWarnings("unchecked")
    void searchesAllCoursesWithoutCourseId() {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        index.search(new float[] { 1f }, 5, null);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sql.capture(), any(SqlParameterSource.class), any(RowMapper.class));
        assertThat(sql.getValue()).doesNotContain("course_id");
    }

    @Test
    @SuppressWarnings("unchecked")
    void databaseFailureIsReportedAsRetrievalUnavailable() {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> index.search(new float[] { 1f }, 5, null))
                .isInstanceOf(RetrievalUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void rendersVectorLiteral() {
        assertThat(PgVectorKnowledgeIndex.toVectorLiteral(new float[] { 1.5f, -2.0f, 0f }))
                .isEqualTo("[1.5,-2.0,0.0]");
        assertThat(PgVectorKnowledgeIndex.toVectorLiteral(new float[0])).isEqualTo("[]");
    }
}
