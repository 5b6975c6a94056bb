package net.storyframe.support.sync;

/**
 * Pulls new images for a keyword query from an external library into the image store.
 */
public interface ImageLibrarySync {

    /**
     * @param keywords library search query
     * @param limit maximum images to fetch
     * @return number of images newly stored
     * @throws LibrarySyncException when the library cannot be queried
     */
    int syncLibrary(String keywords, int limit);
}
