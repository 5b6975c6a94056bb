package net.storyframe.support.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import net.storyframe.application.alignment.SearchKeywordExtractor;
import net.storyframe.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns a scene intent into a short stock-photo search query.
 *
 * <p>Never fails: when the model is unavailable or the call errors, the first
 * three words of the intent are used instead.</p>
 */
@Component
public class OpenAiSearchKeywordExtractor implements SearchKeywordExtractor {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSearchKeywordExtractor.class);
    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final String API_KEY_SENTINEL = "not-configured";
    private static final long MAX_COMPLETION_TOKENS = 20L;
    private static final double SAMPLING_TEMPERATURE = 0.3;
    private static final int FALLBACK_WORD_COUNT = 3;

    private static final String SYSTEM_PROMPT = """
        Extract 2-3 search keywords for finding stock photos that match the scene's visual intent.
        Return ONLY the keywords separated by spaces, no punctuation or quotes.
        Example: "A person feeling overwhelmed in a busy city" -> "overwhelmed city crowd"
        """;

    private final OpenAIClient openAiClient;
    private final boolean available;
    private final String configuredModel;
    private final long requestTimeoutSeconds;

    public OpenAiSearchKeywordExtractor(
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_DEFAULT_LLM_MODEL:${OPENAI_MODEL:" + DEFAULT_MODEL + "}}") String model,
        @Value("${AI_DEFAULT_OPENAI_REQUEST_TIMEOUT_SECONDS:120}") long requestTimeoutSeconds
    ) {
        this.configuredModel = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(UrlUtils.normalizeOpenAiBaseUrl(baseUrl))
                .maxRetries(0)
                .build();
            this.available = true;
            return;
        }

        this.openAiClient = null;
        this.available = false;
        log.warn("Search keyword extraction will use intent fallback: no API key configured");
    }

    @Override
    public String extractSearchKeywords(String intent) {
        if (!StringUtils.hasText(intent)) {
            return "";
        }
        if (!available) {
            return fallbackKeywords(intent);
        }

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(configuredModel))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder().content(SYSTEM_PROMPT).build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(intent).build())
            ))
            .maxCompletionTokens(MAX_COMPLETION_TOKENS)
            .temperature(SAMPLING_TEMPERATURE)
            .build();
        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(Duration.ofSeconds(requestTimeoutSeconds)).build())
            .build();

        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, options);
            String keywords = completion.choices().isEmpty()
                ? ""
                : cleanKeywords(completion.choices().get(0).message().content().orElse(""));
            if (!StringUtils.hasText(keywords)) {
                log.warn("Keyword extraction returned no text (model={}); using intent fallback", configuredModel);
                return fallbackKeywords(intent);
            }
            return keywords;
        } catch (OpenAIException openAiException) {
            log.warn("Keyword extraction failed (model={}): {}; using intent fallback",
                configuredModel, OpenAiErrors.describe(openAiException));
            return fallbackKeywords(intent);
        }
    }

    static String cleanKeywords(String raw) {
        return raw.replace("\"", "").replace("'", "").trim();
    }

    static String fallbackKeywords(String intent) {
        return Arrays.stream(intent.trim().split("\\s+"))
            .limit(FALLBACK_WORD_COUNT)
            .collect(Collectors.joining(" "));
    }
}
