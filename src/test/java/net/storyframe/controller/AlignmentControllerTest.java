package net.storyframe.controller;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import net.storyframe.application.alignment.SceneAlignmentService;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.ImageMetadata;
import net.storyframe.domain.scene.Composition;
import net.storyframe.support.sync.AutoSyncQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AlignmentControllerTest {

    @Mock
    private SceneAlignmentService alignmentService;

    @Mock
    private AutoSyncQueueService autoSyncQueueService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AlignmentController(alignmentService, autoSyncQueueService)).build();
    }

    @Test
    @DisplayName("POST /api/alignment/find-images returns snake_case matches per scene")
    void findImages_returnsMatchesPerScene() throws Exception {
        ImageMatch match = new ImageMatch("img-1", "pexels-1", "https://images.example/1.jpg",
            0.91, 0.9, 1.0, 1.0, 1.0, 1.0,
            new ImageMetadata(8, 5, Composition.defaults(), null, List.of("solitude")));
        when(alignmentService.findAlignedImages(anyList(), eq(3), eq(0.5)))
            .thenReturn(List.of(List.of(match), List.of()));

        mockMvc.perform(post("/api/alignment/find-images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"scenes": [
                       {"intent": "lone hiker", "required_impact": 8,
                        "preferred_composition": {"shot_type": "WS", "angle": "eye"}},
                       {"intent": "empty room", "required_impact": 3}
                     ],
                     "top_k": 3, "mood_consistency_weight": 0.5}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0][0].image_id").value("img-1"))
            .andExpect(jsonPath("$[0][0].match_score").value(0.91))
            .andExpect(jsonPath("$[0][0].metadata.composition.shot_type").value("MS"))
            .andExpect(jsonPath("$[0][0].metadata.mood_dna").doesNotExist())
            .andExpect(jsonPath("$[1].length()").value(0));

        verify(alignmentService).findAlignedImages(
            argThat(scenes -> scenes.size() == 2 && scenes.get(0).requiredImpact() == 8), eq(3), eq(0.5));
    }

    @Test
    @DisplayName("POST /api/alignment/find-images rejects an empty scene list with 400")
    void findImages_rejectsEmptyScenes() throws Exception {
        when(alignmentService.findAlignedImages(anyList(), anyInt(), anyDouble()))
            .thenThrow(new IllegalArgumentException("No scenes provided for image matching"));

        mockMvc.perform(post("/api/alignment/find-images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scenes\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid alignment request"))
            .andExpect(jsonPath("$.message").value("No scenes provided for image matching"));
    }

    @Test
    @DisplayName("GET /api/alignment/auto-sync/queue returns queue depth")
    void autoSyncQueue_returnsSnapshot() throws Exception {
        when(autoSyncQueueService.snapshot()).thenReturn(new AutoSyncQueueService.QueueSnapshot(2, 7));

        mockMvc.perform(get("/api/alignment/auto-sync/queue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pending").value(2))
            .andExpect(jsonPath("$.enqueuedTotal").value(7));
    }
}
