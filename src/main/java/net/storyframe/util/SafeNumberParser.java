package net.storyframe.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Null-safe number parsing for loosely typed analysis payloads.
 *
 * Keeps parse-failure handling and its debug logging in one place.
 */
@Slf4j
public final class SafeNumberParser {

    private SafeNumberParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a finite double, returning {@code null} for blank, malformed, or non-finite input.
     *
     * @example
     * <pre>{@code
     * SafeNumberParser.parseFiniteDoubleOrNull("4800");  // 4800.0
     * SafeNumberParser.parseFiniteDoubleOrNull("warm");  // null
     * SafeNumberParser.parseFiniteDoubleOrNull("NaN");   // null
     * }</pre>
     */
    @Nullable
    public static Double parseFiniteDoubleOrNull(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("Failed to parse double '{}': {}", value, e.getMessage());
            return null;
        }
    }

    /**
     * Parses a number and rounds it to the nearest int, returning {@code defaultValue} on failure.
     */
    public static int parseRoundedInt(@Nullable String value, int defaultValue) {
        Double parsed = parseFiniteDoubleOrNull(value);
        return parsed == null ? defaultValue : (int) Math.round(parsed);
    }
}
