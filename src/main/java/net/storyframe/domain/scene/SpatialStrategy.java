package net.storyframe.domain.scene;

import java.util.List;

/**
 * Spatial layer of a visual intent.
 *
 * @param strategyWords free-form framing phrases ("cluttered frame", "lonely horizon")
 * @param shotType requested shot type, may be {@code null}
 * @param balance requested balance, may be {@code null}
 */
public record SpatialStrategy(List<String> strategyWords, ShotType shotType, Balance balance) {

    public SpatialStrategy {
        strategyWords = strategyWords == null ? List.of() : List.copyOf(strategyWords);
    }
}
