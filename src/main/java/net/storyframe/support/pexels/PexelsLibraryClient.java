package net.storyframe.support.pexels;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.storyframe.adapters.persistence.LibraryImageRepository;
import net.storyframe.domain.image.LibraryImage;
import net.storyframe.support.sync.ImageLibrarySync;
import net.storyframe.support.sync.LibrarySyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * Syncs images from the Pexels search API into the image store.
 * <p>
 * Without {@code PEXELS_API_KEY} every sync is a logged no-op.
 */
@Component
public class PexelsLibraryClient implements ImageLibrarySync {

    private static final Logger log = LoggerFactory.getLogger(PexelsLibraryClient.class);

    static final String SEARCH_URL = "https://api.pexels.com/v1/search";
    static final int MAX_PER_PAGE = 80;

    private final WebClient webClient;
    private final LibraryImageRepository imageRepository;
    private final String apiKey;
    private final Duration requestTimeout;

    public PexelsLibraryClient(WebClient.Builder webClientBuilder,
                               LibraryImageRepository imageRepository,
                               @Value("${PEXELS_API_KEY:}") String apiKey,
                               @Value("${PEXELS_TIMEOUT_SECONDS:15}") long timeoutSeconds) {
        this.webClient = webClientBuilder.build();
        this.imageRepository = imageRepository;
        this.apiKey = apiKey;
        this.requestTimeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public boolean isAvailable() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public int syncLibrary(String keywords, int limit) {
        if (!StringUtils.hasText(keywords)) {
            throw new IllegalArgumentException("Library sync keywords must not be blank");
        }
        if (!isAvailable()) {
            log.warn("Pexels sync skipped for \"{}\": PEXELS_API_KEY is not configured", keywords);
            return 0;
        }
        int perPage = Math.max(1, Math.min(MAX_PER_PAGE, limit));

        JsonNode response;
        try {
            response = webClient.get()
                .uri(SEARCH_URL, uriBuilder -> uriBuilder
                    .queryParam("query", keywords)
                    .queryParam("per_page", perPage)
                    .build())
                .header(HttpHeaders.AUTHORIZATION, apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(requestTimeout);
        } catch (WebClientException | IllegalStateException ex) {
            // IllegalStateException: timeout from block()
            throw new LibrarySyncException("Pexels search failed for \"" + keywords + "\"", ex);
        }

        List<LibraryImage> images = toLibraryImages(response);
        int inserted = imageRepository.insertNew(images);
        log.info("Pexels sync for \"{}\": {} photos fetched, {} new", keywords, images.size(), inserted);
        return inserted;
    }

    /**
     * Maps a search response to library images, skipping photos without an id or URL.
     * Prefers the large rendition over the photo page URL.
     */
    static List<LibraryImage> toLibraryImages(@Nullable JsonNode response) {
        if (response == null || !response.path("photos").isArray()) {
            return List.of();
        }
        List<LibraryImage> images = new ArrayList<>();
        for (JsonNode photo : response.path("photos")) {
            String id = photo.path("id").asText("");
            String url = firstText(photo.path("src").path("large"), photo.path("url"));
            if (id.isEmpty() || url == null) {
                continue;
            }
            images.add(new LibraryImage(id, url, firstText(photo.path("photographer")), firstText(photo.path("alt"))));
        }
        return images;
    }

    @Nullable
    private static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node.isTextual() && StringUtils.hasText(node.asText())) {
                return node.asText();
            }
        }
        return null;
    }
}
