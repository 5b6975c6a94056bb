package net.storyframe.application.alignment;

/**
 * Turns scene text into a fixed-length embedding vector.
 */
public interface EmbeddingProvider {

    /**
     * @throws SceneEmbeddingException when the embedding cannot be produced
     */
    float[] generateEmbedding(String text);
}
