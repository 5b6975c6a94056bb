package net.storyframe.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Request body for {@code POST /api/alignment/find-images}.
 *
 * @param scenes ordered scenes to align
 * @param topK matches per scene, default 5
 * @param moodConsistencyWeight multiplier on the mood-consistency weight, default 1.0
 */
public record FindAlignedImagesRequest(
    List<SceneRequest> scenes,
    @JsonProperty("top_k") Integer topK,
    @JsonProperty("mood_consistency_weight") Double moodConsistencyWeight
) {
}
