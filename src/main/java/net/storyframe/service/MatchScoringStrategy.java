package net.storyframe.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import net.storyframe.domain.image.HexColor;
import net.storyframe.domain.image.ImageCandidate;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.ImageMetadata;
import net.storyframe.domain.image.MoodDna;
import net.storyframe.domain.scene.ColorMapping;
import net.storyframe.domain.scene.Composition;
import net.storyframe.domain.scene.EmotionalLayer;
import net.storyframe.domain.scene.Scene;
import net.storyframe.domain.scene.SubjectTreatment;
import net.storyframe.domain.scene.VisualIntent;

/**
 * Scoring strategy for scene-to-image alignment.
 *
 * <p>Computes the four weighted sub-scores plus the optional intent-depth factor for a
 * single (scene, candidate) pair and ranks a candidate pool. All methods are pure
 * functions of their inputs.</p>
 */
public class MatchScoringStrategy {

    private static final double SHOT_EXACT_SCORE = 0.5;
    private static final double SHOT_ADJACENT_SCORE = 0.25;
    private static final double ANGLE_EXACT_SCORE = 0.5;
    private static final double ANGLE_ANY_SCORE = 0.1;

    private static final double IMPACT_RANGE = 10.0;

    private static final double FIRST_SCENE_MOOD_SCORE = 1.0;
    private static final double MISSING_MOOD_SCORE = 0.5;
    private static final double TEMPERATURE_MISMATCH_PENALTY = 0.2;
    private static final double MAX_COLOR_DISTANCE = 300.0;
    private static final double COLOR_DISTANCE_PENALTY = 0.1;

    private static final double NEUTRAL_DEPTH_SCORE = 1.0;
    private static final double DEPTH_FLOOR = 0.8;
    private static final double DEPTH_RANGE = 0.2;

    private static final Comparator<ImageMatch> BY_SCORE_DESCENDING =
        Comparator.comparingDouble(ImageMatch::matchScore).reversed();

    private final RankingWeights weights;

    public MatchScoringStrategy() {
        this(RankingWeights.defaults());
    }

    public MatchScoringStrategy(RankingWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    /**
     * Scores every candidate against the scene and orders them by descending match score.
     *
     * <p>The sort is stable: candidates with equal scores keep their pool order.</p>
     */
    public List<ImageMatch> rank(Scene scene, List<ImageCandidate> candidates, ScoringContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<ImageMatch> scored = new ArrayList<>(candidates.size());
        for (ImageCandidate candidate : candidates) {
            scored.add(score(scene, candidate, context));
        }
        scored.sort(BY_SCORE_DESCENDING);
        return scored;
    }

    /**
     * Computes all sub-scores and the composite score for one candidate.
     */
    public ImageMatch score(Scene scene, ImageCandidate candidate, ScoringContext context) {
        ImageMetadata metadata = candidate.metadata();

        double vectorSimilarity = candidate.similarity();
        double impactRelevance = calculateImpactRelevance(scene.requiredImpact(), metadata.impactScore());
        double compositionMatch = calculateCompositionMatch(scene.preferredComposition(), metadata.composition());
        double moodConsistency = context.firstScene()
            ? FIRST_SCENE_MOOD_SCORE
            : calculateMoodConsistency(context.anchorMood(), metadata.moodDna());
        double intentDepth = scene.visualIntentLayers()
            .map(intent -> calculateIntentDepth(intent, metadata))
            .orElse(NEUTRAL_DEPTH_SCORE);

        double base = weights.vectorSimilarity() * vectorSimilarity
            + weights.impactRelevance() * impactRelevance
            + weights.compositionMatch() * compositionMatch
            + weights.moodConsistency() * moodConsistency * context.moodConsistencyMultiplier();
        double matchScore = Math.min(1.0, base * (DEPTH_FLOOR + DEPTH_RANGE * intentDepth));

        return new ImageMatch(
            candidate.id(),
            candidate.externalId(),
            candidate.url(),
            matchScore,
            vectorSimilarity,
            impactRelevance,
            compositionMatch,
            moodConsistency,
            intentDepth,
            metadata);
    }

    /**
     * {@code max(0, 1 - |required - actual| / 10)}.
     */
    public double calculateImpactRelevance(int requiredImpact, int imageImpact) {
        return Math.max(0.0, 1.0 - Math.abs(requiredImpact - imageImpact) / IMPACT_RANGE);
    }

    /**
     * Shot type: exact 0.5, one step apart 0.25. Angle: exact 0.5, any other 0.1.
     */
    public double calculateCompositionMatch(Composition preferred, Composition actual) {
        double score = 0.0;
        int shotDistance = preferred.shotType().distanceTo(actual.shotType());
        if (shotDistance == 0) {
            score += SHOT_EXACT_SCORE;
        } else if (shotDistance == 1) {
            score += SHOT_ADJACENT_SCORE;
        }
        score += preferred.angle() == actual.angle() ? ANGLE_EXACT_SCORE : ANGLE_ANY_SCORE;
        return Math.min(1.0, score);
    }

    /**
     * Soft continuity penalty against the anchor mood; 0.5 when either mood is unknown.
     */
    public double calculateMoodConsistency(MoodDna anchorMood, MoodDna candidateMood) {
        if (anchorMood == null || candidateMood == null) {
            return MISSING_MOOD_SCORE;
        }

        double score = 1.0;
        if (anchorMood.temperature().category() != candidateMood.temperature().category()) {
            score -= TEMPERATURE_MISMATCH_PENALTY;
        }
        if (anchorMood.primaryColor() != null && candidateMood.primaryColor() != null) {
            double distance = colorDistance(anchorMood.primaryColor(), candidateMood.primaryColor());
            score -= Math.min(1.0, distance / MAX_COLOR_DISTANCE) * COLOR_DISTANCE_PENALTY;
        }
        return Math.max(0.0, score);
    }

    /**
     * Averages the emotional, color, and subject layer agreements that the intent carries.
     */
    public double calculateIntentDepth(VisualIntent intent, ImageMetadata metadata) {
        double total = 0.0;
        int layers = 0;

        Optional<EmotionalLayer> emotional = intent.emotionalLayer().filter(layer -> !layer.intentWords().isEmpty());
        if (emotional.isPresent()) {
            total += fractionFoundInTags(emotional.get().intentWords(), metadata.metaphoricalTags());
            layers++;
        }

        Optional<ColorMapping> color = intent.colorMapping().filter(layer -> layer.temperature() != null);
        if (color.isPresent()) {
            boolean matches = metadata.mood()
                .map(mood -> mood.temperature().category() == color.get().temperature())
                .orElse(false);
            total += matches ? 1.0 : 0.0;
            layers++;
        }

        Optional<SubjectTreatment> subject = intent.subjectTreatment().filter(layer -> !layer.treatmentWords().isEmpty());
        if (subject.isPresent()) {
            total += fractionFoundInText(subject.get().treatmentWords(), metadata.searchableText());
            layers++;
        }

        return layers == 0 ? NEUTRAL_DEPTH_SCORE : total / layers;
    }

    private double fractionFoundInTags(List<String> words, List<String> tags) {
        List<String> normalizedTags = tags.stream()
            .filter(Objects::nonNull)
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .toList();
        long found = words.stream()
            .map(word -> word.toLowerCase(Locale.ROOT))
            .filter(word -> normalizedTags.stream().anyMatch(tag -> tag.contains(word)))
            .count();
        return (double) found / words.size();
    }

    private double fractionFoundInText(List<String> words, String text) {
        long found = words.stream()
            .map(word -> word.toLowerCase(Locale.ROOT))
            .filter(text::contains)
            .count();
        return (double) found / words.size();
    }

    private double colorDistance(String firstHex, String secondHex) {
        Optional<HexColor> first = HexColor.parse(firstHex);
        Optional<HexColor> second = HexColor.parse(secondHex);
        if (first.isEmpty() || second.isEmpty()) {
            return MAX_COLOR_DISTANCE;
        }
        return first.get().distanceTo(second.get());
    }
}
