package net.storyframe.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One ranked image in an alignment response. */
public record ImageMatchDto(
    @JsonProperty("image_id") String imageId,
    @JsonProperty("external_id") String externalId,
    String url,
    @JsonProperty("match_score") double matchScore,
    @JsonProperty("vector_similarity") double vectorSimilarity,
    @JsonProperty("impact_relevance") double impactRelevance,
    @JsonProperty("composition_match") double compositionMatch,
    @JsonProperty("mood_consistency_score") double moodConsistencyScore,
    @JsonProperty("intent_depth_score") double intentDepthScore,
    MetadataDto metadata
) {

    public record MetadataDto(
        @JsonProperty("impact_score") int impactScore,
        @JsonProperty("visual_weight") int visualWeight,
        CompositionDto composition,
        @JsonProperty("mood_dna") @JsonInclude(JsonInclude.Include.NON_NULL) MoodDnaDto moodDna,
        @JsonProperty("metaphorical_tags") List<String> metaphoricalTags
    ) {
    }

    /**
     * @param temp "warm" or "cold"
     * @param tempKelvin numeric temperature used for clustering
     */
    public record MoodDnaDto(
        String temp,
        @JsonProperty("temp_kelvin") double tempKelvin,
        @JsonProperty("primary_color") String primaryColor,
        String vibe,
        @JsonProperty("emotional_intensity") String emotionalIntensity,
        String rhythm
    ) {
    }
}
