package net.storyframe.domain.scene;

import java.util.Optional;

/**
 * Optional four-layer elaboration of a scene. Any layer may be absent.
 */
public record VisualIntent(EmotionalLayer emotional,
                           SpatialStrategy spatial,
                           SubjectTreatment subject,
                           ColorMapping color) {

    public Optional<EmotionalLayer> emotionalLayer() {
        return Optional.ofNullable(emotional);
    }

    public Optional<SpatialStrategy> spatialStrategy() {
        return Optional.ofNullable(spatial);
    }

    public Optional<SubjectTreatment> subjectTreatment() {
        return Optional.ofNullable(subject);
    }

    public Optional<ColorMapping> colorMapping() {
        return Optional.ofNullable(color);
    }
}
