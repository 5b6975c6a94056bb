package net.storyframe.domain.scene;

import java.util.Locale;
import java.util.Optional;

/**
 * Categorical color temperature used by scene color mappings and image mood fingerprints.
 */
public enum ColorTemperature {
    WARM,
    COLD;

    /**
     * Parses {@code warm}/{@code cold} case-insensitively.
     *
     * @return the parsed category, or empty for blank or unknown text
     */
    public static Optional<ColorTemperature> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "warm" -> Optional.of(WARM);
            case "cold", "cool" -> Optional.of(COLD);
            default -> Optional.empty();
        };
    }
}
