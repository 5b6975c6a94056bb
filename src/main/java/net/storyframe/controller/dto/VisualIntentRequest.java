package net.storyframe.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Optional layered elaboration of a scene.
 */
public record VisualIntentRequest(
    @JsonProperty("emotional_layer") EmotionalLayer emotionalLayer,
    @JsonProperty("spatial_strategy") SpatialStrategy spatialStrategy,
    @JsonProperty("subject_treatment") SubjectTreatment subjectTreatment,
    @JsonProperty("color_mapping") ColorMapping colorMapping
) {

    public record EmotionalLayer(@JsonProperty("intent_words") List<String> intentWords, String vibe) {
    }

    public record SpatialStrategy(
        @JsonProperty("strategy_words") List<String> strategyWords,
        @JsonProperty("shot_type") String shotType,
        String balance
    ) {
    }

    public record SubjectTreatment(
        @JsonProperty("treatment_words") List<String> treatmentWords,
        String identity,
        String dominance
    ) {
    }

    public record ColorMapping(
        @JsonProperty("temperature_words") List<String> temperatureWords,
        String temperature,
        String contrast
    ) {
    }
}
