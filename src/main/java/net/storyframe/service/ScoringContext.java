package net.storyframe.service;

import net.storyframe.domain.image.MoodDna;

/**
 * Sequence position and continuity inputs for scoring one scene.
 *
 * @param firstScene whether the scene opens the sequence (no anchor to violate)
 * @param anchorMood the sequence's visual anchor, {@code null} when none was set
 * @param moodConsistencyMultiplier caller-supplied scale for the mood weight
 */
public record ScoringContext(boolean firstScene, MoodDna anchorMood, double moodConsistencyMultiplier) {

    public static ScoringContext firstScene(double moodConsistencyMultiplier) {
        return new ScoringContext(true, null, moodConsistencyMultiplier);
    }

    public static ScoringContext continuing(MoodDna anchorMood, double moodConsistencyMultiplier) {
        return new ScoringContext(false, anchorMood, moodConsistencyMultiplier);
    }
}
