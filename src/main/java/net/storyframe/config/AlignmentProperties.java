package net.storyframe.config;

import jakarta.annotation.PostConstruct;
import net.storyframe.domain.image.MoodTemperature;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for scene alignment.
 */
@Component
@ConfigurationProperties(prefix = "alignment")
public class AlignmentProperties {

    /**
     * Number of candidates requested from the candidate store per scene.
     */
    private int poolSize = 50;

    /**
     * Candidates at or below this vector similarity are filtered out by the store.
     */
    private double minSimilarity = 0.3;

    /**
     * How far below the required impact a candidate's impact score may fall.
     */
    private int impactTolerance = 2;

    /**
     * Ranked candidates kept per scene before clustering.
     */
    private int rankedCandidateCap = 5;

    /**
     * Matches returned per scene when the caller does not specify top-k.
     */
    private int defaultTopK = 5;

    /**
     * Composite score weights.
     */
    private final Weights weights = new Weights();

    /**
     * Mood clustering thresholds.
     */
    private final Clustering clustering = new Clustering();

    /**
     * Library re-sync for scenes without matches.
     */
    private final AutoSync autoSync = new AutoSync();

    @PostConstruct
    void validate() {
        Assert.isTrue(poolSize >= 1, "alignment.pool-size must be >= 1");
        Assert.isTrue(minSimilarity >= 0.0 && minSimilarity < 1.0, "alignment.min-similarity must be in [0, 1)");
        Assert.isTrue(impactTolerance >= 0, "alignment.impact-tolerance must be non-negative");
        Assert.isTrue(rankedCandidateCap >= 1, "alignment.ranked-candidate-cap must be >= 1");
        Assert.isTrue(defaultTopK >= 1, "alignment.default-top-k must be >= 1");
        Assert.isTrue(autoSync.getImagesPerSync() >= 1 && autoSync.getImagesPerSync() <= 80,
            "alignment.auto-sync.images-per-sync must be in [1, 80]");
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public void setMinSimilarity(double minSimilarity) {
        this.minSimilarity = minSimilarity;
    }

    public int getImpactTolerance() {
        return impactTolerance;
    }

    public void setImpactTolerance(int impactTolerance) {
        this.impactTolerance = impactTolerance;
    }

    public int getRankedCandidateCap() {
        return rankedCandidateCap;
    }

    public void setRankedCandidateCap(int rankedCandidateCap) {
        this.rankedCandidateCap = rankedCandidateCap;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public Weights getWeights() {
        return weights;
    }

    public Clustering getClustering() {
        return clustering;
    }

    public AutoSync getAutoSync() {
        return autoSync;
    }

    /**
     * Composite score weights; defaults match the production ranking.
     */
    public static class Weights {
        private double vectorSimilarity = 0.5;
        private double impactRelevance = 0.3;
        private double compositionMatch = 0.15;
        private double moodConsistency = 0.05;

        public double getVectorSimilarity() {
            return vectorSimilarity;
        }

        public void setVectorSimilarity(double vectorSimilarity) {
            this.vectorSimilarity = vectorSimilarity;
        }

        public double getImpactRelevance() {
            return impactRelevance;
        }

        public void setImpactRelevance(double impactRelevance) {
            this.impactRelevance = impactRelevance;
        }

        public double getCompositionMatch() {
            return compositionMatch;
        }

        public void setCompositionMatch(double compositionMatch) {
            this.compositionMatch = compositionMatch;
        }

        public double getMoodConsistency() {
            return moodConsistency;
        }

        public void setMoodConsistency(double moodConsistency) {
            this.moodConsistency = moodConsistency;
        }
    }

    public static class Clustering {
        private double temperatureThreshold = 1000.0;
        private double defaultTemperature = MoodTemperature.NEUTRAL_KELVIN;
        private double continuityBonus = 0.3;
        private double continuityRange = 4000.0;

        public double getTemperatureThreshold() {
            return temperatureThreshold;
        }

        public void setTemperatureThreshold(double temperatureThreshold) {
            this.temperatureThreshold = temperatureThreshold;
        }

        public double getDefaultTemperature() {
            return defaultTemperature;
        }

        public void setDefaultTemperature(double defaultTemperature) {
            this.defaultTemperature = defaultTemperature;
        }

        public double getContinuityBonus() {
            return continuityBonus;
        }

        public void setContinuityBonus(double continuityBonus) {
            this.continuityBonus = continuityBonus;
        }

        public double getContinuityRange() {
            return continuityRange;
        }

        public void setContinuityRange(double continuityRange) {
            this.continuityRange = continuityRange;
        }
    }

    public static class AutoSync {
        private boolean workerEnabled = true;
        private int imagesPerSync = 5;

        public boolean isWorkerEnabled() {
            return workerEnabled;
        }

        public void setWorkerEnabled(boolean workerEnabled) {
            this.workerEnabled = workerEnabled;
        }

        public int getImagesPerSync() {
            return imagesPerSync;
        }

        public void setImagesPerSync(int imagesPerSync) {
            this.imagesPerSync = imagesPerSync;
        }
    }
}
