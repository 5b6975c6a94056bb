package net.storyframe.support.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.openai.models.embeddings.EmbeddingModel;
import java.time.Duration;
import java.util.List;
import net.storyframe.application.alignment.EmbeddingProvider;
import net.storyframe.application.alignment.SceneEmbeddingException;
import net.storyframe.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * OpenAI-backed {@link EmbeddingProvider} for scene search text.
 */
@Component
public class OpenAiEmbeddingClient implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);
    private static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final String API_KEY_SENTINEL = "not-configured";

    private final OpenAIClient openAiClient;
    private final boolean available;
    private final String configuredModel;
    private final long requestTimeoutSeconds;

    public OpenAiEmbeddingClient(
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_DEFAULT_EMBEDDING_MODEL:" + DEFAULT_MODEL + "}") String model,
        @Value("${AI_DEFAULT_OPENAI_EMBEDDING_TIMEOUT_SECONDS:30}") long requestTimeoutSeconds
    ) {
        this.configuredModel = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String resolvedBaseUrl = UrlUtils.normalizeOpenAiBaseUrl(baseUrl);
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .build();
            this.available = true;
            log.info("Scene embedding client configured (model={}, baseUrl={})", configuredModel, resolvedBaseUrl);
            return;
        }

        this.openAiClient = null;
        this.available = false;
        log.warn("Scene embedding client is disabled: no API key configured");
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public float[] generateEmbedding(String text) {
        if (!available) {
            throw new SceneEmbeddingException("Scene embedding is not configured: missing OpenAI API key");
        }
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("Embedding text must not be blank");
        }

        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
            .model(EmbeddingModel.of(configuredModel))
            .input(text)
            .build();
        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(Duration.ofSeconds(requestTimeoutSeconds)).build())
            .build();

        try {
            CreateEmbeddingResponse response = openAiClient.embeddings().create(params, options);
            if (response.data().isEmpty()) {
                throw new SceneEmbeddingException("Embedding response contained no vectors (model=" + configuredModel + ")");
            }
            return toFloatArray(response.data().get(0).embedding());
        } catch (OpenAIException openAiException) {
            String detail = OpenAiErrors.describe(openAiException);
            log.error("Embedding API call failed (model={}): {}", configuredModel, detail);
            throw new SceneEmbeddingException(
                "Scene embedding failed (%s): %s".formatted(configuredModel, detail),
                openAiException
            );
        }
    }

    private static float[] toFloatArray(List<? extends Number> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
