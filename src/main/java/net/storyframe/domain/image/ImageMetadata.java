package net.storyframe.domain.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import net.storyframe.domain.scene.Composition;

/**
 * Analysis metadata attached to an indexed image.
 *
 * @param impactScore subject prominence, 1 to 10
 * @param visualWeight visual weight, 1 to 10
 * @param composition analyzed framing
 * @param moodDna mood fingerprint, {@code null} when the image was never mood-analyzed
 * @param metaphoricalTags metaphorical tags produced by image analysis
 */
public record ImageMetadata(int impactScore,
                            int visualWeight,
                            Composition composition,
                            MoodDna moodDna,
                            List<String> metaphoricalTags) {

    public ImageMetadata {
        composition = composition == null ? Composition.defaults() : composition;
        metaphoricalTags = metaphoricalTags == null ? List.of() : List.copyOf(metaphoricalTags);
    }

    public Optional<MoodDna> mood() {
        return Optional.ofNullable(moodDna);
    }

    /**
     * Flattens every metadata value into one lower-case string for phrase lookups.
     */
    public String searchableText() {
        List<String> parts = new ArrayList<>();
        parts.add("impactScore=" + impactScore);
        parts.add("visualWeight=" + visualWeight);
        parts.add(composition.negativeSpace().name());
        parts.add(composition.shotType().name());
        parts.add(composition.angle().name());
        parts.add(composition.balance().name());
        parts.add(composition.subjectDominance().name());
        if (moodDna != null) {
            parts.add(moodDna.temperature().toString());
            addIfPresent(parts, moodDna.primaryColor());
            addIfPresent(parts, moodDna.vibe());
            addIfPresent(parts, moodDna.emotionalIntensity());
            addIfPresent(parts, moodDna.rhythm());
        }
        parts.addAll(metaphoricalTags);
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }
}
