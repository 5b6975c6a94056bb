package net.storyframe.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import net.storyframe.domain.image.LibraryImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class LibraryImageRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private LibraryImageRepository repository;

    @BeforeEach
    void setUp() {
        repository = new LibraryImageRepository(jdbcTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void should_CountOnlyInsertedRows_When_SomeImagesAlreadyExist() {
        when(jdbcTemplate.batchUpdate(eq(LibraryImageRepository.INSERT_SQL), anyList())).thenReturn(new int[] {1, 0});

        int inserted = repository.insertNew(List.of(
            new LibraryImage("101", "https://images.example/101.jpg", "Ana", "harbour"),
            new LibraryImage("102", "https://images.example/102.jpg", null, null)));

        ArgumentCaptor<List<Object[]>> args = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(eq(LibraryImageRepository.INSERT_SQL), args.capture());
        assertThat(inserted).isEqualTo(1);
        assertThat(args.getValue().get(0)).containsExactly("101", "https://images.example/101.jpg", "Ana", "harbour");
    }

    @Test
    void should_SkipDatabase_When_NothingToInsert() {
        assertThat(repository.insertNew(List.of())).isZero();
        verifyNoInteractions(jdbcTemplate);
    }
}
