package net.storyframe.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Framing fields in their lower-case wire form; used in requests and responses. */
public record CompositionDto(
    @JsonProperty("negative_space") String negativeSpace,
    @JsonProperty("shot_type") String shotType,
    String angle,
    String balance,
    @JsonProperty("subject_dominance") String subjectDominance
) {
}
