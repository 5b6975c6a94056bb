package net.storyframe.domain.image;

import java.util.Objects;

/**
 * An image fetched from an external library, not yet analyzed or embedded.
 *
 * @param externalId upstream library identifier
 * @param url image URL
 * @param photographer credited photographer, may be {@code null}
 * @param altText upstream alt text, may be {@code null}
 */
public record LibraryImage(String externalId, String url, String photographer, String altText) {

    public LibraryImage {
        Objects.requireNonNull(externalId, "externalId");
        Objects.requireNonNull(url, "url");
    }
}
