package net.storyframe.adapters.persistence;

import java.util.List;
import net.storyframe.domain.image.LibraryImage;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts freshly synced library images. Analysis and embedding rows are written
 * later by the ingestion pipeline.
 */
@Repository
public class LibraryImageRepository {

    static final String INSERT_SQL = """
        INSERT INTO images (external_id, url, photographer, alt_text)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (external_id) DO NOTHING
        """;

    private final JdbcTemplate jdbcTemplate;

    public LibraryImageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return number of rows inserted; images already stored are skipped
     */
    @Transactional
    public int insertNew(List<LibraryImage> images) {
        if (images == null || images.isEmpty()) {
            return 0;
        }
        List<Object[]> batchArgs = images.stream()
            .map(image -> new Object[] {image.externalId(), image.url(), image.photographer(), image.altText()})
            .toList();
        int inserted = 0;
        for (int count : jdbcTemplate.batchUpdate(INSERT_SQL, batchArgs)) {
            if (count > 0) {
                inserted += count;
            }
        }
        return inserted;
    }
}
