package net.storyframe.application.alignment;

/**
 * Thrown when a scene embedding cannot be generated.
 */
public class SceneEmbeddingException extends RuntimeException {

    public SceneEmbeddingException(String message) {
        super(message);
    }

    public SceneEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
