package com.example.AusFin.repository;

import com.example.AusFin.model.IndexHit;
import com.example.AusFin.model.Passage;
import com.example.AusFin.model.SourceMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * pgvector-backed {@link VectorIndex} over the {@code kb_passages} table.
 */
@Repository
@RequiredArgsConstructor
public class PgVectorKnowledgeIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorKnowledgeIndex.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Cosine distance operator {@code <=>}; similarity score = 1 - distance.
     */
    @Override
    public List<IndexHit> search(float[] embedding, int topK) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT id,
                       1 - (embedding <=> ?) AS score
                FROM kb_passages
                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setObject(2, queryVector);
            ps.setInt(3, topK);
        }, (rs, rowNum) -> new IndexHit(rs.getString("id"), rs.getDouble("score")));
    }

    @Override
    public Optional<Passage> fetch(String passageId) {
        String sql = """
                SELECT id,
                       doc_type,
                       authority,
                       published_date,
                       content,
                       metadata
                FROM kb_passages
                WHERE id = ?
                """;

        return jdbcTemplate.query(sql, new PassageRowMapper(), passageId).stream().findFirst();
    }

    private class PassageRowMapper implements RowMapper<Passage> {
        @Override
        public Passage mapRow(ResultSet rs, int rowNum) throws SQLException {
            Date published = rs.getDate("published_date");
            SourceMetadata metadata = new SourceMetadata(
                    rs.getString("doc_type"),
                    published == null ? null : published.toLocalDate(),
                    rs.getString("authority"),
                    readSource(rs.getString("id"), rs.getString("metadata"))
            );
            return new Passage(rs.getString("id"), rs.getString("content"), metadata);
        }
    }

    private String readSource(String passageId, String metadataJson) {
        if (metadataJson == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(metadataJson);
            return node.hasNonNull("source") ? node.get("source").asText() : null;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata for passage {}: {}", passageId, e.getOriginalMessage());
            return null;
        }
    }
}
