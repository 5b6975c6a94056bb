package net.storyframe.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.MoodDna;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups ranked matches into mood-coherent clusters and picks the cluster that best
 * continues the sequence's running mood.
 *
 * <p>Grouping is a single-pass greedy partition, not k-means. Seeds are taken in
 * descending match-score order (ties keep input order): the highest-scoring unassigned
 * match opens a cluster and absorbs every unassigned match whose temperature lies
 * within {@link ClusteringSettings#temperatureThreshold()} of the seed. Every input
 * match lands in exactly one cluster.</p>
 */
public class MoodClusteringStrategy {

    private static final Logger log = LoggerFactory.getLogger(MoodClusteringStrategy.class);

    private static final Comparator<ImageMatch> BY_SCORE_DESCENDING =
        Comparator.comparingDouble(ImageMatch::matchScore).reversed();

    private final ClusteringSettings settings;

    public MoodClusteringStrategy() {
        this(ClusteringSettings.defaults());
    }

    public MoodClusteringStrategy(ClusteringSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Partitions matches by temperature proximity to the highest-scoring remaining seed.
     *
     * @return clusters in seed order; empty when there are no matches
     */
    public List<MoodCluster> groupByMood(List<ImageMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return List.of();
        }

        List<ImageMatch> sorted = new ArrayList<>(matches);
        sorted.sort(BY_SCORE_DESCENDING);
        boolean[] assigned = new boolean[sorted.size()];
        List<MoodCluster> clusters = new ArrayList<>();

        for (int seedIndex = 0; seedIndex < sorted.size(); seedIndex++) {
            if (assigned[seedIndex]) {
                continue;
            }
            ImageMatch seed = sorted.get(seedIndex);
            assigned[seedIndex] = true;
            List<ImageMatch> members = new ArrayList<>();
            members.add(seed);
            double seedTemperature = temperatureOf(seed);

            for (int candidateIndex = seedIndex + 1; candidateIndex < sorted.size(); candidateIndex++) {
                if (assigned[candidateIndex]) {
                    continue;
                }
                ImageMatch candidate = sorted.get(candidateIndex);
                if (Math.abs(seedTemperature - temperatureOf(candidate)) <= settings.temperatureThreshold()) {
                    members.add(candidate);
                    assigned[candidateIndex] = true;
                }
            }
            clusters.add(new MoodCluster(members));
        }

        log.debug("Grouped {} matches into {} mood clusters", matches.size(), clusters.size());
        return clusters;
    }

    /**
     * Returns the cluster with the highest average match score plus continuity bonus.
     *
     * <p>Without a context mood only the average score counts. Ties keep the
     * first-seen cluster.</p>
     *
     * @param contextMood mood of the previous scene's top pick, or {@code null}
     * @return the best cluster, or {@link MoodCluster#empty()} when there are none
     */
    public MoodCluster selectBest(List<MoodCluster> clusters, MoodDna contextMood) {
        if (clusters == null || clusters.isEmpty()) {
            return MoodCluster.empty();
        }

        MoodCluster best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (MoodCluster cluster : clusters) {
            if (cluster.isEmpty()) {
                continue;
            }
            double score = cluster.averageMatchScore();
            if (contextMood != null) {
                score += continuityBonus(cluster, contextMood);
            }
            if (score > bestScore) {
                bestScore = score;
                best = cluster;
            }
        }
        return best == null ? MoodCluster.empty() : best;
    }

    /**
     * {@code max(0, bonus * (1 - |clusterTemp - contextTemp| / range))}.
     */
    public double continuityBonus(MoodCluster cluster, MoodDna contextMood) {
        double clusterTemperature = cluster.averageTemperature(settings.defaultTemperature());
        double difference = Math.abs(clusterTemperature - contextMood.temperature().kelvin());
        return Math.max(0.0, settings.continuityBonus() * (1.0 - difference / settings.continuityRange()));
    }

    private double temperatureOf(ImageMatch match) {
        return match.moodDna()
            .map(mood -> mood.temperature().kelvin())
            .orElse(settings.defaultTemperature());
    }
}
