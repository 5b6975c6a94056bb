package net.storyframe.service;

/**
 * Immutable weights of the composite match score.
 *
 * <p>The production weights are {@link #defaults()}; alternative weight sets exist for
 * experiments and tests. Ranking order across the whole sequence depends on these
 * values, so they are never mutated after construction.</p>
 *
 * @param vectorSimilarity weight of the candidate-store similarity
 * @param impactRelevance weight of the impact closeness
 * @param compositionMatch weight of the framing agreement
 * @param moodConsistency weight of the anchor mood agreement (before the caller multiplier)
 */
public record RankingWeights(double vectorSimilarity,
                             double impactRelevance,
                             double compositionMatch,
                             double moodConsistency) {

    private static final RankingWeights DEFAULTS = new RankingWeights(0.5, 0.3, 0.15, 0.05);

    public RankingWeights {
        requireWeight(vectorSimilarity, "vectorSimilarity");
        requireWeight(impactRelevance, "impactRelevance");
        requireWeight(compositionMatch, "compositionMatch");
        requireWeight(moodConsistency, "moodConsistency");
    }

    public static RankingWeights defaults() {
        return DEFAULTS;
    }

    private static void requireWeight(double weight, String name) {
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("Ranking weight " + name + " must be a finite, non-negative number");
        }
    }
}
