package net.storyframe.domain.image;

import java.util.Optional;

/**
 * A candidate image scored against one scene.
 *
 * @param imageId internal image identifier
 * @param externalId upstream image library identifier
 * @param url image URL
 * @param matchScore composite ranking value in {@code [0, 1]}
 * @param vectorSimilarity candidate-store similarity
 * @param impactRelevance closeness of the image impact to the required impact
 * @param compositionMatch shot-type and angle agreement
 * @param moodConsistencyScore agreement with the sequence's visual anchor
 * @param intentDepthScore agreement with the scene's layered visual intent
 * @param metadata original image metadata
 */
public record ImageMatch(String imageId,
                         String externalId,
                         String url,
                         double matchScore,
                         double vectorSimilarity,
                         double impactRelevance,
                         double compositionMatch,
                         double moodConsistencyScore,
                         double intentDepthScore,
                         ImageMetadata metadata) {

    public Optional<MoodDna> moodDna() {
        return metadata == null ? Optional.empty() : metadata.mood();
    }
}
