package net.storyframe.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.util.List;
import net.storyframe.config.AlignmentProperties;
import net.storyframe.domain.image.ImageCandidate;
import net.storyframe.domain.scene.ShotType;
import net.storyframe.mapper.CandidateMetadataNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
class PgVectorCandidateRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgVectorCandidateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PgVectorCandidateRepository(
            jdbcTemplate, new CandidateMetadataNormalizer(new ObjectMapper()), new AlignmentProperties());
    }

    @Test
    void should_QueryWithVectorLiteralAndFilters_When_Searching() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any(), any(), any(), any()))
            .thenReturn(List.of());

        repository.searchCandidates(new float[] {0.25f, -1.0f}, 6, 50);

        verify(jdbcTemplate).query(eq(PgVectorCandidateRepository.SEARCH_SQL), any(RowMapper.class),
            eq("[0.25,-1.0]"), eq(6), eq("[0.25,-1.0]"), eq(0.3), eq(50));
    }

    @Test
    void should_ReturnEmptyList_When_QueryFails() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any(), any(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(repository.searchCandidates(new float[] {0.1f}, 1, 50)).isEmpty();
    }

    @Test
    void should_RejectEmptyEmbedding_When_Searching() {
        assertThatThrownBy(() -> repository.searchCandidates(new float[0], 1, 50))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_NormalizeRow_When_MappingResultSet() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("img-1");
        when(rs.getString("external_id")).thenReturn("pexels-42");
        when(rs.getString("url")).thenReturn("https://images.example/42.jpg");
        when(rs.getString("photographer")).thenReturn("A. Lens");
        when(rs.getDouble("similarity")).thenReturn(1.0000001);
        when(rs.getString("metadata")).thenReturn("""
            {"impactScore": 7, "visualWeight": 4, "composition": {"shot_type": "CU"},
             "moodDna": null, "metaphoricalTags": ["solitude"]}
            """);

        ImageCandidate candidate = repository.mapCandidate(rs, 0);

        assertThat(candidate.id()).isEqualTo("img-1");
        assertThat(candidate.externalId()).isEqualTo("pexels-42");
        assertThat(candidate.similarity()).isEqualTo(1.0);
        assertThat(candidate.metadata().impactScore()).isEqualTo(7);
        assertThat(candidate.metadata().composition().shotType()).isEqualTo(ShotType.CU);
        assertThat(candidate.metadata().moodDna()).isNull();
        assertThat(candidate.metadata().metaphoricalTags()).containsExactly("solitude");
    }
}
