package net.storyframe.util;

import org.springframework.lang.Nullable;

/**
 * URL helpers for upstream API configuration.
 */
public final class UrlUtils {

    private static final String DEFAULT_OPENAI_BASE_URL = "https://api.openai.com/v1";

    private UrlUtils() {
    }

    /**
     * Normalizes an OpenAI-compatible base URL so it ends in {@code /v1} without a trailing slash.
     *
     * <p>A base URL copied from an embeddings endpoint has the {@code /embeddings} suffix removed.</p>
     */
    public static String normalizeOpenAiBaseUrl(@Nullable String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return DEFAULT_OPENAI_BASE_URL;
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith("/embeddings")) {
            normalized = normalized.substring(0, normalized.length() - "/embeddings".length());
        }
        return normalized.endsWith("/v1") ? normalized : normalized + "/v1";
    }
}
