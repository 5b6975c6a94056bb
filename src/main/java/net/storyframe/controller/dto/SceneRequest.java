package net.storyframe.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One scene as received over HTTP. */
public record SceneRequest(
    String intent,
    @JsonProperty("required_impact") Double requiredImpact,
    @JsonProperty("preferred_composition") CompositionDto preferredComposition,
    @JsonProperty("visual_intent") VisualIntentRequest visualIntent
) {
}
