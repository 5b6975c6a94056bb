package net.storyframe.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import net.storyframe.application.alignment.CandidateStore;
import net.storyframe.config.AlignmentProperties;
import net.storyframe.domain.image.ImageCandidate;
import net.storyframe.mapper.CandidateMetadataNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres/pgvector adapter for nearest-neighbour image lookups.
 *
 * <p>Similarity is cosine similarity, {@code 1 - (embedding <=> query)}. Rows are
 * filtered on impact score and the configured similarity floor, then returned
 * most similar first.</p>
 */
@Repository
public class PgVectorCandidateRepository implements CandidateStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorCandidateRepository.class);

    static final String SEARCH_SQL = """
        SELECT
          img.id,
          img.external_id,
          img.url,
          img.photographer,
          1 - (emb.embedding <=> ?::vector) AS similarity,
          json_build_object(
            'impactScore', meta.impact_score,
            'visualWeight', meta.visual_weight,
            'composition', meta.composition,
            'moodDna', meta.mood_dna,
            'metaphoricalTags', meta.metaphorical_tags
          )::text AS metadata
        FROM image_embeddings emb
        JOIN images img ON emb.image_id = img.id
        JOIN image_metadata meta ON meta.image_id = img.id
        WHERE meta.impact_score >= ?
          AND (1 - (emb.embedding <=> ?::vector)) > ?
        ORDER BY similarity DESC
        LIMIT ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final CandidateMetadataNormalizer normalizer;
    private final AlignmentProperties properties;
    private final RowMapper<ImageCandidate> rowMapper = this::mapCandidate;

    public PgVectorCandidateRepository(JdbcTemplate jdbcTemplate,
                                       CandidateMetadataNormalizer normalizer,
                                       AlignmentProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    /**
     * Returns up to {@code poolSize} candidates with impact at least {@code minImpact}.
     *
     * @return candidates by descending similarity; empty when the query fails
     */
    @Override
    @Transactional(readOnly = true)
    public List<ImageCandidate> searchCandidates(float[] embedding, int minImpact, int poolSize) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Query embedding must not be empty");
        }
        String vectorLiteral = toVectorLiteral(embedding);
        try {
            List<ImageCandidate> candidates = jdbcTemplate.query(
                SEARCH_SQL,
                rowMapper,
                vectorLiteral,
                minImpact,
                vectorLiteral,
                properties.getMinSimilarity(),
                poolSize
            );
            log.debug("Found {} candidate images (minImpact={}, poolSize={})", candidates.size(), minImpact, poolSize);
            return candidates;
        } catch (DataAccessException ex) {
            log.error("Vector search failed (minImpact={}, poolSize={})", minImpact, poolSize, ex);
            return List.of();
        }
    }

    ImageCandidate mapCandidate(ResultSet rs, int rowNum) throws SQLException {
        return new ImageCandidate(
            rs.getString("id"),
            rs.getString("external_id"),
            rs.getString("url"),
            rs.getString("photographer"),
            CandidateMetadataNormalizer.clampSimilarity(rs.getDouble("similarity")),
            normalizer.normalize(rs.getString("metadata"))
        );
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder literal = new StringBuilder(embedding.length * 10).append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                literal.append(',');
            }
            literal.append(embedding[i]);
        }
        return literal.append(']').toString();
    }
}
