package net.storyframe.domain.scene;

import java.util.List;

/**
 * Emotional layer of a visual intent.
 *
 * @param intentWords words describing the feeling the image should carry
 * @param vibe overall vibe label, may be {@code null}
 */
public record EmotionalLayer(List<String> intentWords, String vibe) {

    public EmotionalLayer {
        intentWords = intentWords == null ? List.of() : List.copyOf(intentWords);
    }
}
