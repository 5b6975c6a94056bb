package net.storyframe.domain.scene;

import java.util.Objects;

/**
 * Framing description shared by scene preferences and analyzed images.
 *
 * <p>All fields are populated; missing values are filled by the ingestion
 * normalizers before a composition reaches scoring code.</p>
 *
 * @param negativeSpace where the empty area of the frame sits
 * @param shotType camera distance
 * @param angle camera angle
 * @param balance visual balance of the frame
 * @param subjectDominance how strongly the subject dominates the frame
 */
public record Composition(NegativeSpace negativeSpace,
                          ShotType shotType,
                          CameraAngle angle,
                          Balance balance,
                          SubjectDominance subjectDominance) {

    public Composition {
        Objects.requireNonNull(negativeSpace, "negativeSpace");
        Objects.requireNonNull(shotType, "shotType");
        Objects.requireNonNull(angle, "angle");
        Objects.requireNonNull(balance, "balance");
        Objects.requireNonNull(subjectDominance, "subjectDominance");
    }

    /**
     * Returns the neutral composition used when a record carries no framing data.
     */
    public static Composition defaults() {
        return new Composition(NegativeSpace.CENTER, ShotType.MS, CameraAngle.EYE,
            Balance.ASYMMETRICAL, SubjectDominance.MODERATE);
    }
}
