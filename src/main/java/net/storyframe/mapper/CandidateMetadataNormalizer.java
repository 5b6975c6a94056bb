package net.storyframe.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.storyframe.domain.image.ImageMetadata;
import net.storyframe.domain.image.MoodDna;
import net.storyframe.domain.image.MoodTemperature;
import net.storyframe.domain.scene.Balance;
import net.storyframe.domain.scene.CameraAngle;
import net.storyframe.domain.scene.ColorTemperature;
import net.storyframe.domain.scene.Composition;
import net.storyframe.domain.scene.NegativeSpace;
import net.storyframe.domain.scene.ShotType;
import net.storyframe.domain.scene.SubjectDominance;
import net.storyframe.util.EnumParsingUtils;
import net.storyframe.util.SafeNumberParser;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Converts loosely shaped image-analysis JSON into well-formed {@link ImageMetadata}.
 * <p>
 * Every field gets a default, so partial or malformed analyses still score:
 * <ul>
 *   <li>impact score and visual weight are clamped to 1..10, default 5</li>
 *   <li>composition fields parse case-insensitively, defaulting to {@link Composition#defaults()}</li>
 *   <li>a missing mood stays missing; a present one has its labels defaulted</li>
 *   <li>tags are capped at 15 and fall back to {@code metaphorical_field}</li>
 * </ul>
 * Both camelCase and snake_case keys are accepted.
 */
@Component
@Slf4j
public class CandidateMetadataNormalizer {

    static final int DEFAULT_SCORE = 5;
    static final int MAX_TAGS = 15;
    private static final int MIN_SCORE = 1;
    private static final int MAX_SCORE = 10;

    private final ObjectMapper objectMapper;

    public CandidateMetadataNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and normalizes a JSON metadata document; blank or malformed input yields all defaults.
     */
    public ImageMetadata normalize(@Nullable String json) {
        if (json == null || json.isBlank()) {
            return normalize((JsonNode) null);
        }
        try {
            return normalize(objectMapper.readTree(json));
        } catch (JsonProcessingException ex) {
            log.warn("Unparseable image metadata, using defaults: {}", ex.getOriginalMessage());
            return normalize((JsonNode) null);
        }
    }

    public ImageMetadata normalize(@Nullable JsonNode node) {
        return new ImageMetadata(
            clampScore(field(node, "impactScore", "impact_score")),
            clampScore(field(node, "visualWeight", "visual_weight")),
            normalizeComposition(field(node, "composition")),
            normalizeMood(field(node, "moodDna", "mood_dna")),
            normalizeTags(node)
        );
    }

    public Composition normalizeComposition(@Nullable JsonNode node) {
        Composition defaults = Composition.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new Composition(
            EnumParsingUtils.parseOrDefault(text(field(node, "negativeSpace", "negative_space")),
                NegativeSpace.class, defaults.negativeSpace()),
            EnumParsingUtils.parseOrDefault(text(field(node, "shotType", "shot_type")),
                ShotType.class, defaults.shotType()),
            EnumParsingUtils.parseOrDefault(text(field(node, "angle")),
                CameraAngle.class, defaults.angle()),
            EnumParsingUtils.parseOrDefault(text(field(node, "balance")),
                Balance.class, defaults.balance()),
            EnumParsingUtils.parseOrDefault(text(field(node, "subjectDominance", "subject_dominance")),
                SubjectDominance.class, defaults.subjectDominance())
        );
    }

    /**
     * Clamps a similarity to [0, 1]; NaN becomes 0.
     */
    public static double clampSimilarity(double similarity) {
        if (Double.isNaN(similarity)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    @Nullable
    MoodDna normalizeMood(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new MoodDna(
            parseTemperature(field(node, "temp", "temperature")),
            nonBlankOrNull(text(field(node, "primaryColor", "primary_color"))),
            textOrDefault(field(node, "vibe"), "neutral"),
            textOrDefault(field(node, "emotionalIntensity", "emotional_intensity"), "medium"),
            textOrDefault(field(node, "rhythm"), "calm")
        );
    }

    /**
     * Accepts Kelvin as a number or numeric text, or a warm/cold label; anything else is warm.
     */
    MoodTemperature parseTemperature(@Nullable JsonNode node) {
        if (node != null && node.isNumber() && Double.isFinite(node.asDouble())) {
            return MoodTemperature.ofKelvin(node.asDouble());
        }
        String raw = text(node);
        if (raw != null) {
            Double kelvin = SafeNumberParser.parseFiniteDoubleOrNull(raw);
            if (kelvin != null) {
                return MoodTemperature.ofKelvin(kelvin);
            }
            return ColorTemperature.parse(raw)
                .map(MoodTemperature::of)
                .orElse(MoodTemperature.of(ColorTemperature.WARM));
        }
        return MoodTemperature.of(ColorTemperature.WARM);
    }

    private List<String> normalizeTags(@Nullable JsonNode node) {
        JsonNode tags = field(node, "metaphoricalTags", "metaphorical_tags");
        if (tags == null || !tags.isArray()) {
            tags = field(node, "metaphoricalField", "metaphorical_field");
        }
        if (tags == null || !tags.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (JsonNode tag : tags) {
            if (result.size() == MAX_TAGS) {
                break;
            }
            String value = text(tag);
            if (value != null && !value.isBlank()) {
                result.add(value.trim());
            }
        }
        return result;
    }

    private static int clampScore(@Nullable JsonNode node) {
        int value = DEFAULT_SCORE;
        if (node != null && node.isNumber()) {
            value = (int) Math.round(node.asDouble());
        } else if (node != null && node.isTextual()) {
            value = SafeNumberParser.parseRoundedInt(node.asText(), DEFAULT_SCORE);
        }
        if (value == 0) {
            // zero means "not analyzed" upstream
            value = DEFAULT_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }

    @Nullable
    private static JsonNode field(@Nullable JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    @Nullable
    private static String text(@Nullable JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String textOrDefault(@Nullable JsonNode node, String defaultValue) {
        String value = nonBlankOrNull(text(node));
        return value == null ? defaultValue : value;
    }

    @Nullable
    private static String nonBlankOrNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
