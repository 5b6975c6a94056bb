package net.storyframe.service;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import net.storyframe.domain.image.ImageMatch;

/**
 * Mood-coherent group of ranked matches for one scene.
 *
 * <p>A cluster produced by {@link MoodClusteringStrategy#groupByMood} is never empty;
 * {@link #empty()} exists only as the selection result for a scene with no matches.</p>
 */
public record MoodCluster(List<ImageMatch> members) {

    private static final MoodCluster EMPTY = new MoodCluster(List.of());

    public MoodCluster {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static MoodCluster empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    public double averageMatchScore() {
        return average(ImageMatch::matchScore, 0.0);
    }

    /**
     * Simple mean of member temperatures, substituting {@code defaultTemperature} for members without a mood.
     */
    public double averageTemperature(double defaultTemperature) {
        return average(match -> match.moodDna()
            .map(mood -> mood.temperature().kelvin())
            .orElse(defaultTemperature), defaultTemperature);
    }

    /**
     * Members re-sorted by descending match score and truncated to {@code limit}.
     */
    public List<ImageMatch> topMatches(int limit) {
        return members.stream()
            .sorted(Comparator.comparingDouble(ImageMatch::matchScore).reversed())
            .limit(Math.max(0, limit))
            .toList();
    }

    private double average(ToDoubleFunction<ImageMatch> extractor, double fallback) {
        if (members.isEmpty()) {
            return fallback;
        }
        double sum = 0.0;
        for (ImageMatch member : members) {
            sum += extractor.applyAsDouble(member);
        }
        return sum / members.size();
    }
}
