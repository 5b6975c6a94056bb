package net.storyframe.domain.image;

import java.util.Objects;

/**
 * Color-temperature, vibe, and rhythm fingerprint of an analyzed image.
 *
 * @param temperature mood temperature, never {@code null}
 * @param primaryColor dominant color as a hex string, {@code null} when the analysis had none
 * @param vibe vibe label ("minimalist", "cinematic")
 * @param emotionalIntensity intensity label ("low", "medium", "strong")
 * @param rhythm rhythm label ("calm", "dynamic", "tense")
 */
public record MoodDna(MoodTemperature temperature,
                      String primaryColor,
                      String vibe,
                      String emotionalIntensity,
                      String rhythm) {

    public MoodDna {
        Objects.requireNonNull(temperature, "temperature");
    }
}
