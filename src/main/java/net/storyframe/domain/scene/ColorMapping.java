package net.storyframe.domain.scene;

import java.util.List;

/**
 * Color layer of a visual intent.
 *
 * @param temperatureWords phrases describing light and palette ("harsh light")
 * @param temperature requested temperature category, may be {@code null}
 * @param contrast requested contrast label, may be {@code null}
 */
public record ColorMapping(List<String> temperatureWords, ColorTemperature temperature, String contrast) {

    public ColorMapping {
        temperatureWords = temperatureWords == null ? List.of() : List.copyOf(temperatureWords);
    }
}
