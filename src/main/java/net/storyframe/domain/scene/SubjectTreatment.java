package net.storyframe.domain.scene;

import java.util.List;

/**
 * Subject layer of a visual intent.
 *
 * @param treatmentWords phrases describing how the subject is shown ("hidden face")
 * @param identity subject identity hint, may be {@code null}
 * @param dominance subject dominance hint, may be {@code null}
 */
public record SubjectTreatment(List<String> treatmentWords, String identity, String dominance) {

    public SubjectTreatment {
        treatmentWords = treatmentWords == null ? List.of() : List.copyOf(treatmentWords);
    }
}
