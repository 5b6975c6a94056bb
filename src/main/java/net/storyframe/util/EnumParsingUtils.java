package net.storyframe.util;

import java.util.Locale;

/**
 * Shared helper for safely parsing loosely typed strings into enum values.
 */
public final class EnumParsingUtils {

    private EnumParsingUtils() {
        // Utility class
    }

    /**
     * Parses {@code raw} case-insensitively; blank or unknown values yield {@code defaultValue}.
     */
    public static <E extends Enum<E>> E parseOrDefault(String raw,
                                                       Class<E> enumType,
                                                       E defaultValue) {
        if (raw == null) {
            return defaultValue;
        }

        String candidate = raw.trim();
        if (candidate.isEmpty()) {
            return defaultValue;
        }

        try {
            return Enum.valueOf(enumType, candidate.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return defaultValue;
        }
    }
}
