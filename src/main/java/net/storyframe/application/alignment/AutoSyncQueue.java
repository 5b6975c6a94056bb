package net.storyframe.application.alignment;

/**
 * Accepts library re-sync requests for scenes that found no matching images.
 */
public interface AutoSyncQueue {

    /**
     * Enqueues a re-sync job for the given search keywords.
     *
     * @return identifier of the queued job
     */
    String enqueueAutoSync(String keywords);
}
