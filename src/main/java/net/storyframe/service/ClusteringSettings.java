package net.storyframe.service;

import net.storyframe.domain.image.MoodTemperature;

/**
 * Thresholds of the mood clustering heuristics.
 *
 * @param temperatureThreshold maximum temperature distance between a seed and a member
 * @param defaultTemperature temperature assumed for matches without a mood
 * @param continuityBonus maximum bonus for a cluster whose temperature equals the context mood
 * @param continuityRange temperature distance at which the continuity bonus reaches zero
 */
public record ClusteringSettings(double temperatureThreshold,
                                 double defaultTemperature,
                                 double continuityBonus,
                                 double continuityRange) {

    private static final ClusteringSettings DEFAULTS = new ClusteringSettings(1000.0, MoodTemperature.NEUTRAL_KELVIN, 0.3, 4000.0);

    public ClusteringSettings {
        if (temperatureThreshold < 0.0) {
            throw new IllegalArgumentException("temperatureThreshold must be non-negative");
        }
        if (continuityRange <= 0.0) {
            throw new IllegalArgumentException("continuityRange must be positive");
        }
        if (continuityBonus < 0.0) {
            throw new IllegalArgumentException("continuityBonus must be non-negative");
        }
    }

    public static ClusteringSettings defaults() {
        return DEFAULTS;
    }
}
