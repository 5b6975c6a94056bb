package net.storyframe.domain.image;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RGB color parsed from a {@code #RRGGBB} hex string.
 */
public record HexColor(int red, int green, int blue) {

    private static final Pattern HEX_PATTERN = Pattern.compile("^#?([a-fA-F\\d]{2})([a-fA-F\\d]{2})([a-fA-F\\d]{2})$");

    /**
     * Parses a six-digit hex color with an optional leading {@code #}.
     *
     * @return parsed color, or empty when the text is not a six-digit hex value
     */
    public static Optional<HexColor> parse(String hex) {
        if (hex == null) {
            return Optional.empty();
        }
        Matcher matcher = HEX_PATTERN.matcher(hex.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new HexColor(
            Integer.parseInt(matcher.group(1), 16),
            Integer.parseInt(matcher.group(2), 16),
            Integer.parseInt(matcher.group(3), 16)));
    }

    /**
     * Euclidean distance in RGB space.
     */
    public double distanceTo(HexColor other) {
        int redDiff = red - other.red;
        int greenDiff = green - other.green;
        int blueDiff = blue - other.blue;
        return Math.sqrt(redDiff * redDiff + greenDiff * greenDiff + blueDiff * blueDiff);
    }
}
