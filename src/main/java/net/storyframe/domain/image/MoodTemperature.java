package net.storyframe.domain.image;

import java.util.Locale;
import java.util.Objects;
import net.storyframe.domain.scene.ColorTemperature;

/**
 * Color temperature of an image mood, stored either as a Kelvin-like number or as
 * a {@link ColorTemperature} category.
 *
 * <p>Both views are always available. A categorical value reports
 * {@link #WARM_KELVIN} or {@link #COLD_KELVIN} as its numeric form; a numeric value
 * reports {@link ColorTemperature#WARM} at or above {@link #CATEGORY_SPLIT_KELVIN}.
 * Higher values read as warmer on this scale.</p>
 */
public final class MoodTemperature {

    /** Neutral daylight, assumed for images without a mood. */
    public static final double NEUTRAL_KELVIN = 5500.0;
    public static final double WARM_KELVIN = 6000.0;
    public static final double COLD_KELVIN = 3000.0;
    public static final double CATEGORY_SPLIT_KELVIN = 4500.0;

    private final double kelvin;
    private final ColorTemperature declaredCategory;

    private MoodTemperature(double kelvin, ColorTemperature declaredCategory) {
        this.kelvin = kelvin;
        this.declaredCategory = declaredCategory;
    }

    public static MoodTemperature ofKelvin(double kelvin) {
        if (!Double.isFinite(kelvin)) {
            throw new IllegalArgumentException("Mood temperature must be finite: " + kelvin);
        }
        return new MoodTemperature(kelvin, null);
    }

    public static MoodTemperature of(ColorTemperature category) {
        Objects.requireNonNull(category, "category");
        return new MoodTemperature(category == ColorTemperature.WARM ? WARM_KELVIN : COLD_KELVIN, category);
    }

    public double kelvin() {
        return kelvin;
    }

    public ColorTemperature category() {
        if (declaredCategory != null) {
            return declaredCategory;
        }
        return kelvin >= CATEGORY_SPLIT_KELVIN ? ColorTemperature.WARM : ColorTemperature.COLD;
    }

    /**
     * Indicates the value was supplied as {@code warm}/{@code cold} rather than a number.
     */
    public boolean isCategorical() {
        return declaredCategory != null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MoodTemperature that)) {
            return false;
        }
        return Double.compare(kelvin, that.kelvin) == 0 && declaredCategory == that.declaredCategory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kelvin, declaredCategory);
    }

    @Override
    public String toString() {
        return isCategorical() ? declaredCategory.name().toLowerCase(Locale.ROOT) : kelvin + "K";
    }
}
