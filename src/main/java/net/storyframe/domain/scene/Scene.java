package net.storyframe.domain.scene;

import java.util.Objects;
import java.util.Optional;

/**
 * One narrative beat that needs a matching image.
 *
 * <p>Scenes are immutable inputs to the alignment engine. Impact is expected in
 * {@code 1..10}; request mappers clamp it before a scene is constructed.</p>
 *
 * @param intent free-text description of what the scene should show
 * @param requiredImpact desired subject prominence, 1 to 10
 * @param preferredComposition preferred framing
 * @param visualIntent optional layered elaboration, may be {@code null}
 */
public record Scene(String intent,
                    int requiredImpact,
                    Composition preferredComposition,
                    VisualIntent visualIntent) {

    public Scene {
        intent = intent == null ? "" : intent;
        Objects.requireNonNull(preferredComposition, "preferredComposition");
    }

    public Scene(String intent, int requiredImpact, Composition preferredComposition) {
        this(intent, requiredImpact, preferredComposition, null);
    }

    public Optional<VisualIntent> visualIntentLayers() {
        return Optional.ofNullable(visualIntent);
    }
}
