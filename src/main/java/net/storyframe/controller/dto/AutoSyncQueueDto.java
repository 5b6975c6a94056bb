package net.storyframe.controller.dto;

/** Auto-sync queue depth for monitoring. */
public record AutoSyncQueueDto(int pending, long enqueuedTotal) {
}
