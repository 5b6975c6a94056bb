package net.storyframe.application.alignment;

import java.util.ArrayList;
import java.util.List;
import net.storyframe.domain.scene.ColorMapping;
import net.storyframe.domain.scene.EmotionalLayer;
import net.storyframe.domain.scene.Scene;
import net.storyframe.domain.scene.SpatialStrategy;
import net.storyframe.domain.scene.SubjectTreatment;
import net.storyframe.domain.scene.VisualIntent;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the text that is embedded for a scene.
 *
 * <p>Scenes with a visual intent are rendered as a labelled search formula so the
 * embedding sees the emotional, spatial, subject, and color phrases explicitly:</p>
 * <pre>
 * CORE_INTENT: overwhelmed
 * SPATIAL_STRATEGY: cluttered frame
 * SUBJECT_TREATMENT: hidden face
 * COLOR_PROFILE: harsh light
 * KEYWORD_STRING: A person feeling overwhelmed, cluttered frame, overwhelmed, harsh light
 * </pre>
 */
@Component
public class SceneSearchTextBuilder {

    private static final String SEPARATOR = ", ";

    public String build(Scene scene) {
        String intent = scene.intent().trim();
        if (scene.visualIntentLayers().isEmpty()) {
            return intent;
        }
        VisualIntent visualIntent = scene.visualIntent();

        List<String> emotionalWords = visualIntent.emotionalLayer().map(EmotionalLayer::intentWords).orElse(List.of());
        List<String> strategyWords = visualIntent.spatialStrategy().map(SpatialStrategy::strategyWords).orElse(List.of());
        List<String> treatmentWords = visualIntent.subjectTreatment().map(SubjectTreatment::treatmentWords).orElse(List.of());
        List<String> temperatureWords = visualIntent.colorMapping().map(ColorMapping::temperatureWords).orElse(List.of());

        List<String> lines = new ArrayList<>();
        appendLine(lines, "CORE_INTENT", emotionalWords);
        appendLine(lines, "SPATIAL_STRATEGY", strategyWords);
        appendLine(lines, "SUBJECT_TREATMENT", treatmentWords);
        appendLine(lines, "COLOR_PROFILE", temperatureWords);

        List<String> keywords = new ArrayList<>();
        if (StringUtils.hasText(intent)) {
            keywords.add(intent);
        }
        keywords.addAll(strategyWords);
        keywords.addAll(emotionalWords);
        keywords.addAll(temperatureWords);
        lines.add("KEYWORD_STRING: " + String.join(SEPARATOR, keywords));

        return String.join("\n", lines);
    }

    private void appendLine(List<String> lines, String label, List<String> words) {
        if (!words.isEmpty()) {
            lines.add(label + ": " + String.join(SEPARATOR, words));
        }
    }
}
