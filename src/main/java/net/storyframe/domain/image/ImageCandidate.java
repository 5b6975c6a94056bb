package net.storyframe.domain.image;

import java.util.Objects;

/**
 * Read-only snapshot of an indexed image returned by the candidate store for one scene.
 *
 * @param id internal image identifier
 * @param externalId identifier at the upstream image library
 * @param url image URL
 * @param photographer credited photographer, may be {@code null}
 * @param similarity vector similarity to the scene embedding, in {@code [0, 1]}
 * @param metadata normalized analysis metadata
 */
public record ImageCandidate(String id,
                             String externalId,
                             String url,
                             String photographer,
                             double similarity,
                             ImageMetadata metadata) {

    public ImageCandidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metadata, "metadata");
    }
}
