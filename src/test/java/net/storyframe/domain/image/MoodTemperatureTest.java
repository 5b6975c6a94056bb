package net.storyframe.domain.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import net.storyframe.domain.scene.ColorTemperature;
import org.junit.jupiter.api.Test;

class MoodTemperatureTest {

    @Test
    void should_MapCategoriesToRepresentativeKelvin_When_BuiltFromLabel() {
        assertThat(MoodTemperature.of(ColorTemperature.WARM).kelvin()).isEqualTo(6000.0);
        assertThat(MoodTemperature.of(ColorTemperature.COLD).kelvin()).isEqualTo(3000.0);
        assertThat(MoodTemperature.of(ColorTemperature.WARM).isCategorical()).isTrue();
    }

    @Test
    void should_DeriveCategoryFromSplit_When_BuiltFromKelvin() {
        assertThat(MoodTemperature.ofKelvin(4500).category()).isEqualTo(ColorTemperature.WARM);
        assertThat(MoodTemperature.ofKelvin(4499.9).category()).isEqualTo(ColorTemperature.COLD);
        assertThat(MoodTemperature.ofKelvin(MoodTemperature.NEUTRAL_KELVIN).category()).isEqualTo(ColorTemperature.WARM);
    }

    @Test
    void should_RejectNonFiniteKelvin_When_Building() {
        assertThatThrownBy(() -> MoodTemperature.ofKelvin(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_MeasureEuclideanRgbDistance_When_ParsingHexColors() {
        HexColor warm = HexColor.parse("#FF6B6B").orElseThrow();
        HexColor cold = HexColor.parse("4a90e2").orElseThrow();

        assertThat(warm.distanceTo(cold)).isCloseTo(Math.sqrt(181 * 181 + 37 * 37 + 119 * 119), within(1e-9));
        assertThat(HexColor.parse("neutral")).isEmpty();
        assertThat(HexColor.parse("#FFF")).isEmpty();
    }
}
