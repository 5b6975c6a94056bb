package net.storyframe.service;

import static net.storyframe.testutil.AlignmentTestData.candidate;
import static net.storyframe.testutil.AlignmentTestData.coldMood;
import static net.storyframe.testutil.AlignmentTestData.composition;
import static net.storyframe.testutil.AlignmentTestData.metadata;
import static net.storyframe.testutil.AlignmentTestData.scene;
import static net.storyframe.testutil.AlignmentTestData.warmMood;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import net.storyframe.domain.image.ImageCandidate;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.MoodDna;
import net.storyframe.domain.scene.CameraAngle;
import net.storyframe.domain.scene.ColorMapping;
import net.storyframe.domain.scene.ColorTemperature;
import net.storyframe.domain.scene.Composition;
import net.storyframe.domain.scene.EmotionalLayer;
import net.storyframe.domain.scene.Scene;
import net.storyframe.domain.scene.ShotType;
import net.storyframe.domain.scene.SubjectTreatment;
import net.storyframe.domain.scene.VisualIntent;
import org.junit.jupiter.api.Test;

class MatchScoringStrategyTest {

    private final MatchScoringStrategy strategy = new MatchScoringStrategy();

    @Test
    void should_ScoreNearPerfectMatch_When_FirstSceneCandidateMatchesImpactAndFraming() {
        Composition wideEye = composition(ShotType.WS, CameraAngle.EYE);
        Scene scene = new Scene("lone hiker on a ridge", 8, wideEye);
        ImageCandidate candidate = candidate("a", 0.9, metadata(8, wideEye, null));

        ImageMatch match = strategy.score(scene, candidate, ScoringContext.firstScene(1.0));

        assertThat(match.impactRelevance()).isEqualTo(1.0);
        assertThat(match.compositionMatch()).isEqualTo(1.0);
        assertThat(match.moodConsistencyScore()).isEqualTo(1.0);
        assertThat(match.intentDepthScore()).isEqualTo(1.0);
        assertThat(match.matchScore()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void should_GivePartialCompositionCredit_When_ShotTypeIsOneStepAway() {
        double score = strategy.calculateCompositionMatch(
            composition(ShotType.WS, CameraAngle.EYE),
            composition(ShotType.MS, CameraAngle.EYE));

        assertThat(score).isEqualTo(0.75);
    }

    @Test
    void should_GiveOnlyAngleFloor_When_ShotTypesAreTwoStepsApartAndAnglesDiffer() {
        double score = strategy.calculateCompositionMatch(
            composition(ShotType.CU, CameraAngle.LOW),
            composition(ShotType.WS, CameraAngle.HIGH));

        assertThat(score).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void should_ApplySoftPenalty_When_LaterSceneCandidateBreaksWarmAnchor() {
        Scene scene = scene("quiet office at night", 5);
        ImageCandidate coldCandidate = candidate("cold", 0.8, 5, coldMood("#4A90E2"));

        ImageMatch match = strategy.score(scene, coldCandidate,
            ScoringContext.continuing(warmMood("#FF6B6B"), 1.0));

        assertThat(match.moodConsistencyScore()).isLessThan(1.0).isGreaterThanOrEqualTo(0.7);
    }

    @Test
    void should_ReturnHalfScore_When_EitherMoodIsMissing() {
        assertThat(strategy.calculateMoodConsistency(null, warmMood("#FFFFFF"))).isEqualTo(0.5);
        assertThat(strategy.calculateMoodConsistency(warmMood("#FFFFFF"), null)).isEqualTo(0.5);
    }

    @Test
    void should_TreatInvalidHexAsMaximumDistance_When_ComparingColors() {
        MoodDna anchor = warmMood("#FF6B6B");
        MoodDna invalid = warmMood("not-a-color");

        assertThat(strategy.calculateMoodConsistency(anchor, invalid)).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void should_ScoreFullConsistency_When_MoodsAreIdentical() {
        assertThat(strategy.calculateMoodConsistency(warmMood("#336699"), warmMood("336699"))).isEqualTo(1.0);
    }

    @Test
    void should_FloorImpactRelevanceAtZero_When_ImpactGapIsLarge() {
        assertThat(strategy.calculateImpactRelevance(1, 10)).isCloseTo(0.1, within(1e-9));
        assertThat(strategy.calculateImpactRelevance(10, 10)).isEqualTo(1.0);
        assertThat(strategy.calculateImpactRelevance(-5, 10)).isEqualTo(0.0);
    }

    @Test
    void should_AverageOnlyPresentLayers_When_ComputingIntentDepth() {
        VisualIntent intent = new VisualIntent(
            new EmotionalLayer(List.of("overwhelmed", "isolation"), "oppressive"),
            null,
            new SubjectTreatment(List.of("hidden face"), "concealed", "weak"),
            new ColorMapping(List.of("harsh light"), ColorTemperature.COLD, "high"));

        double depth = strategy.calculateIntentDepth(intent,
            metadata(5, Composition.defaults(), coldMood("#4A90E2"), "Overwhelmed crowd", "hidden face"));

        // emotional 1/2, color 1, subject 1
        assertThat(depth).isCloseTo(2.5 / 3.0, within(1e-9));
    }

    @Test
    void should_ScoreColorLayerZero_When_CandidateHasNoMood() {
        VisualIntent intent = new VisualIntent(null, null, null,
            new ColorMapping(List.of(), ColorTemperature.WARM, null));

        assertThat(strategy.calculateIntentDepth(intent, metadata(5, Composition.defaults(), null))).isEqualTo(0.0);
    }

    @Test
    void should_ReturnNeutralDepth_When_IntentHasNoUsableLayers() {
        VisualIntent intent = new VisualIntent(new EmotionalLayer(List.of(), "calm"), null, null, null);

        assertThat(strategy.calculateIntentDepth(intent, metadata(5, Composition.defaults(), null))).isEqualTo(1.0);
    }

    @Test
    void should_DampenScore_When_IntentDepthIsZero() {
        Composition wideEye = composition(ShotType.WS, CameraAngle.EYE);
        VisualIntent intent = new VisualIntent(new EmotionalLayer(List.of("grief"), null), null, null, null);
        Scene scene = new Scene("empty chair", 8, wideEye, intent);

        ImageMatch match = strategy.score(scene, candidate("a", 0.9, metadata(8, wideEye, null, "sunrise")),
            ScoringContext.firstScene(1.0));

        assertThat(match.intentDepthScore()).isEqualTo(0.0);
        assertThat(match.matchScore()).isCloseTo(0.95 * 0.8, within(1e-9));
    }

    @Test
    void should_KeepScoresWithinUnitInterval_When_MultiplierIsLarge() {
        Composition wideEye = composition(ShotType.WS, CameraAngle.EYE);
        Scene scene = new Scene("storm", 8, wideEye);

        ImageMatch match = strategy.score(scene, candidate("a", 1.0, metadata(8, wideEye, warmMood("#FF0000"))),
            ScoringContext.continuing(warmMood("#FF0000"), 10.0));

        assertThat(match.matchScore()).isEqualTo(1.0);
    }

    @Test
    void should_RankDescendingAndKeepPoolOrder_When_ScoresTie() {
        Scene scene = scene("harbour at dawn", 5);
        List<ImageCandidate> pool = List.of(
            candidate("low", 0.4, 5, null),
            candidate("tie-1", 0.7, 5, null),
            candidate("tie-2", 0.7, 5, null),
            candidate("high", 0.95, 5, null));

        List<ImageMatch> ranked = strategy.rank(scene, pool, ScoringContext.firstScene(1.0));

        assertThat(ranked).extracting(ImageMatch::imageId).containsExactly("high", "tie-1", "tie-2", "low");
    }

    @Test
    void should_ReturnEmptyRanking_When_PoolIsEmpty() {
        assertThat(strategy.rank(scene("x", 5), List.of(), ScoringContext.firstScene(1.0))).isEmpty();
    }

    @Test
    void should_UseInjectedWeights_When_AlternativeWeightSetIsSupplied() {
        MatchScoringStrategy similarityOnly = new MatchScoringStrategy(new RankingWeights(1.0, 0.0, 0.0, 0.0));

        ImageMatch match = similarityOnly.score(scene("river", 5), candidate("a", 0.42, 1, null),
            ScoringContext.firstScene(1.0));

        assertThat(match.matchScore()).isCloseTo(0.42, within(1e-9));
    }

    @Test
    void should_RejectWeights_When_AnyWeightIsNegativeOrNotFinite() {
        assertThatThrownBy(() -> new RankingWeights(-0.1, 0.3, 0.15, 0.05))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RankingWeights(0.5, Double.NaN, 0.15, 0.05))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
