package net.storyframe.controller.dto;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.image.ImageMetadata;
import net.storyframe.domain.image.MoodDna;
import net.storyframe.domain.scene.Balance;
import net.storyframe.domain.scene.CameraAngle;
import net.storyframe.domain.scene.ColorMapping;
import net.storyframe.domain.scene.ColorTemperature;
import net.storyframe.domain.scene.Composition;
import net.storyframe.domain.scene.EmotionalLayer;
import net.storyframe.domain.scene.NegativeSpace;
import net.storyframe.domain.scene.Scene;
import net.storyframe.domain.scene.ShotType;
import net.storyframe.domain.scene.SpatialStrategy;
import net.storyframe.domain.scene.SubjectDominance;
import net.storyframe.domain.scene.SubjectTreatment;
import net.storyframe.domain.scene.VisualIntent;
import net.storyframe.util.EnumParsingUtils;

/**
 * Maps between the snake_case alignment wire format and domain records.
 */
public final class AlignmentDtoMapper {

    static final int DEFAULT_REQUIRED_IMPACT = 5;

    private AlignmentDtoMapper() {
        // Utility class
    }

    public static List<Scene> toScenes(List<SceneRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream().map(AlignmentDtoMapper::toScene).toList();
    }

    /**
     * Builds a scene with impact clamped to 1..10 and unknown framing values defaulted.
     *
     * @throws IllegalArgumentException when the scene entry itself is null
     */
    public static Scene toScene(SceneRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Scene entries must not be null");
        }
        return new Scene(
            request.intent() == null ? "" : request.intent().trim(),
            clampImpact(request.requiredImpact()),
            toComposition(request.preferredComposition()),
            toVisualIntent(request.visualIntent())
        );
    }

    static int clampImpact(Double requiredImpact) {
        if (requiredImpact == null || !Double.isFinite(requiredImpact)) {
            return DEFAULT_REQUIRED_IMPACT;
        }
        long rounded = Math.round(requiredImpact);
        return (int) Math.max(1, Math.min(10, rounded));
    }

    static Composition toComposition(CompositionDto dto) {
        Composition defaults = Composition.defaults();
        if (dto == null) {
            return defaults;
        }
        return new Composition(
            EnumParsingUtils.parseOrDefault(dto.negativeSpace(), NegativeSpace.class, defaults.negativeSpace()),
            EnumParsingUtils.parseOrDefault(dto.shotType(), ShotType.class, defaults.shotType()),
            EnumParsingUtils.parseOrDefault(dto.angle(), CameraAngle.class, defaults.angle()),
            EnumParsingUtils.parseOrDefault(dto.balance(), Balance.class, defaults.balance()),
            EnumParsingUtils.parseOrDefault(dto.subjectDominance(), SubjectDominance.class, defaults.subjectDominance())
        );
    }

    /**
     * Returns {@code null} when every layer is missing or carries no usable content.
     */
    static VisualIntent toVisualIntent(VisualIntentRequest dto) {
        if (dto == null) {
            return null;
        }
        EmotionalLayer emotional = null;
        if (dto.emotionalLayer() != null && !words(dto.emotionalLayer().intentWords()).isEmpty()) {
            emotional = new EmotionalLayer(words(dto.emotionalLayer().intentWords()), dto.emotionalLayer().vibe());
        }
        SpatialStrategy spatial = null;
        if (dto.spatialStrategy() != null && !words(dto.spatialStrategy().strategyWords()).isEmpty()) {
            VisualIntentRequest.SpatialStrategy raw = dto.spatialStrategy();
            spatial = new SpatialStrategy(words(raw.strategyWords()),
                EnumParsingUtils.parseOrDefault(raw.shotType(), ShotType.class, null),
                EnumParsingUtils.parseOrDefault(raw.balance(), Balance.class, null));
        }
        SubjectTreatment subject = null;
        if (dto.subjectTreatment() != null && !words(dto.subjectTreatment().treatmentWords()).isEmpty()) {
            VisualIntentRequest.SubjectTreatment raw = dto.subjectTreatment();
            subject = new SubjectTreatment(words(raw.treatmentWords()), raw.identity(), raw.dominance());
        }
        ColorMapping color = null;
        if (dto.colorMapping() != null) {
            VisualIntentRequest.ColorMapping raw = dto.colorMapping();
            ColorTemperature temperature = ColorTemperature.parse(raw.temperature()).orElse(null);
            List<String> temperatureWords = words(raw.temperatureWords());
            if (temperature != null || !temperatureWords.isEmpty()) {
                color = new ColorMapping(temperatureWords, temperature, raw.contrast());
            }
        }
        if (emotional == null && spatial == null && subject == null && color == null) {
            return null;
        }
        return new VisualIntent(emotional, spatial, subject, color);
    }

    public static ImageMatchDto toDto(ImageMatch match) {
        ImageMetadata metadata = match.metadata();
        return new ImageMatchDto(
            match.imageId(),
            match.externalId(),
            match.url(),
            match.matchScore(),
            match.vectorSimilarity(),
            match.impactRelevance(),
            match.compositionMatch(),
            match.moodConsistencyScore(),
            match.intentDepthScore(),
            new ImageMatchDto.MetadataDto(
                metadata.impactScore(),
                metadata.visualWeight(),
                toDto(metadata.composition()),
                metadata.mood().map(AlignmentDtoMapper::toDto).orElse(null),
                metadata.metaphoricalTags()
            )
        );
    }

    public static List<List<ImageMatchDto>> toDtos(List<List<ImageMatch>> matchesPerScene) {
        return matchesPerScene.stream()
            .map(matches -> matches.stream().map(AlignmentDtoMapper::toDto).toList())
            .toList();
    }

    static CompositionDto toDto(Composition composition) {
        return new CompositionDto(
            lower(composition.negativeSpace()),
            composition.shotType().name(),
            lower(composition.angle()),
            lower(composition.balance()),
            lower(composition.subjectDominance())
        );
    }

    static ImageMatchDto.MoodDnaDto toDto(MoodDna mood) {
        return new ImageMatchDto.MoodDnaDto(
            lower(mood.temperature().category()),
            mood.temperature().kelvin(),
            mood.primaryColor(),
            mood.vibe(),
            mood.emotionalIntensity(),
            mood.rhythm()
        );
    }

    private static List<String> words(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(word -> !word.isEmpty())
            .toList();
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
