package net.storyframe.domain.scene;

/**
 * Camera distance of a frame, ordered from tightest to widest.
 *
 * <p>Declaration order is significant: adjacency between shot types is measured
 * by ordinal distance.</p>
 */
public enum ShotType {
    /** Close-up. */
    CU,
    /** Medium shot. */
    MS,
    /** Wide shot. */
    WS;

    /**
     * Returns the number of steps between two shot types on the CU/MS/WS scale.
     */
    public int distanceTo(ShotType other) {
        return Math.abs(ordinal() - other.ordinal());
    }
}
