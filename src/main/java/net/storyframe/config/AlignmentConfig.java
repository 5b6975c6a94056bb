package net.storyframe.config;

import net.storyframe.service.ClusteringSettings;
import net.storyframe.service.MatchScoringStrategy;
import net.storyframe.service.MoodClusteringStrategy;
import net.storyframe.service.RankingWeights;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the pure scoring and clustering strategies from {@link AlignmentProperties}.
 */
@Configuration
public class AlignmentConfig {

    @Bean
    public MatchScoringStrategy matchScoringStrategy(AlignmentProperties properties) {
        AlignmentProperties.Weights weights = properties.getWeights();
        return new MatchScoringStrategy(new RankingWeights(
            weights.getVectorSimilarity(),
            weights.getImpactRelevance(),
            weights.getCompositionMatch(),
            weights.getMoodConsistency()));
    }

    @Bean
    public MoodClusteringStrategy moodClusteringStrategy(AlignmentProperties properties) {
        AlignmentProperties.Clustering clustering = properties.getClustering();
        return new MoodClusteringStrategy(new ClusteringSettings(
            clustering.getTemperatureThreshold(),
            clustering.getDefaultTemperature(),
            clustering.getContinuityBonus(),
            clustering.getContinuityRange()));
    }

    /**
     * Scheduler for fire-and-forget zero-match fallbacks; shared elastic pool, never awaited.
     */
    @Bean
    public Scheduler alignmentFallbackScheduler() {
        return Schedulers.boundedElastic();
    }
}
