package net.storyframe.application.alignment;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.storyframe.config.AlignmentProperties;
import net.storyframe.domain.image.ImageCandidate;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.MoodDna;
import net.storyframe.domain.scene.Scene;
import net.storyframe.service.MatchScoringStrategy;
import net.storyframe.service.MoodCluster;
import net.storyframe.service.MoodClusteringStrategy;
import net.storyframe.service.ScoringContext;
import org.springframework.stereotype.Service;

/**
 * Selects mood-coherent images for an ordered sequence of scenes.
 *
 * <p>Scenes are processed strictly in order. The first scene's top pick fixes the
 * sequence's visual anchor, which every later scene is scored against; the previous
 * scene's top pick steers cluster selection. A scene whose lookup fails or yields
 * nothing contributes an empty list and triggers a non-blocking library re-sync.</p>
 */
@Service
@Slf4j
public class SceneAlignmentService {

    static final String NO_SCENES_MESSAGE = "No scenes provided for image matching";
    private static final double DEFAULT_MOOD_CONSISTENCY_MULTIPLIER = 1.0;

    private final EmbeddingProvider embeddingProvider;
    private final CandidateStore candidateStore;
    private final MatchScoringStrategy scoringStrategy;
    private final MoodClusteringStrategy clusteringStrategy;
    private final SceneSearchTextBuilder searchTextBuilder;
    private final ZeroMatchFallbackDispatcher fallbackDispatcher;
    private final AlignmentProperties properties;

    public SceneAlignmentService(EmbeddingProvider embeddingProvider,
                                 CandidateStore candidateStore,
                                 MatchScoringStrategy scoringStrategy,
                                 MoodClusteringStrategy clusteringStrategy,
                                 SceneSearchTextBuilder searchTextBuilder,
                                 ZeroMatchFallbackDispatcher fallbackDispatcher,
                                 AlignmentProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.candidateStore = candidateStore;
        this.scoringStrategy = scoringStrategy;
        this.clusteringStrategy = clusteringStrategy;
        this.searchTextBuilder = searchTextBuilder;
        this.fallbackDispatcher = fallbackDispatcher;
        this.properties = properties;
    }

    /**
     * Aligns scenes using the configured top-k and the neutral mood multiplier.
     */
    public List<List<ImageMatch>> findAlignedImages(List<Scene> scenes) {
        return findAlignedImages(scenes, properties.getDefaultTopK(), DEFAULT_MOOD_CONSISTENCY_MULTIPLIER);
    }

    /**
     * Returns one match list per scene, in scene order, each sorted by descending match score.
     *
     * @param scenes ordered scenes; must not be empty
     * @param topK maximum matches per scene; non-positive values use the configured default
     * @param moodConsistencyMultiplier scale for the mood weight; non-finite or non-positive values use 1.0
     * @throws IllegalArgumentException when {@code scenes} is null or empty
     */
    public List<List<ImageMatch>> findAlignedImages(List<Scene> scenes, int topK, double moodConsistencyMultiplier) {
        if (scenes == null || scenes.isEmpty()) {
            throw new IllegalArgumentException(NO_SCENES_MESSAGE);
        }
        int limit = topK > 0 ? topK : properties.getDefaultTopK();
        double multiplier = Double.isFinite(moodConsistencyMultiplier) && moodConsistencyMultiplier > 0
            ? moodConsistencyMultiplier
            : DEFAULT_MOOD_CONSISTENCY_MULTIPLIER;

        List<List<ImageMatch>> results = new ArrayList<>(scenes.size());
        MoodDna visualAnchor = null;
        MoodDna previousSceneMood = null;
        int nonEmpty = 0;

        for (int i = 0; i < scenes.size(); i++) {
            Scene scene = scenes.get(i);
            List<ImageMatch> selection;
            try {
                ScoringContext context = i == 0
                    ? ScoringContext.firstScene(multiplier)
                    : ScoringContext.continuing(visualAnchor, multiplier);
                MoodCluster chosen = selectCluster(scene, context, i == 0 ? null : previousSceneMood);
                selection = chosen.topMatches(limit);
            } catch (RuntimeException ex) {
                log.error("Alignment failed for scene {}: {}", i, ex.getMessage(), ex);
                selection = List.of();
            }

            if (selection.isEmpty()) {
                fallbackDispatcher.dispatch(i, scene.intent());
            } else {
                MoodDna topMood = selection.get(0).metadata().moodDna();
                if (i == 0) {
                    visualAnchor = topMood;
                    log.debug("Visual anchor set from scene 0: {}", topMood);
                }
                previousSceneMood = topMood;
                nonEmpty++;
            }
            results.add(selection);
        }

        log.info("Aligned {} scenes ({} with matches)", scenes.size(), nonEmpty);
        return results;
    }

    private MoodCluster selectCluster(Scene scene, ScoringContext context, MoodDna contextMood) {
        float[] embedding = embeddingProvider.generateEmbedding(searchTextBuilder.build(scene));
        int minImpact = Math.max(1, scene.requiredImpact() - properties.getImpactTolerance());
        List<ImageCandidate> pool = candidateStore.searchCandidates(embedding, minImpact, properties.getPoolSize());

        List<ImageMatch> ranked = scoringStrategy.rank(scene, pool, context);
        List<ImageMatch> capped = ranked.size() > properties.getRankedCandidateCap()
            ? ranked.subList(0, properties.getRankedCandidateCap())
            : ranked;

        List<MoodCluster> clusters = clusteringStrategy.groupByMood(capped);
        return clusteringStrategy.selectBest(clusters, contextMood);
    }
}
