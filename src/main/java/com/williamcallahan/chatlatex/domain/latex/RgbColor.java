package com.williamcallahan.chatlatex.domain.latex;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text color for rendered formulas, with channels in the 0..1 range used by {@code xcolor}.
 *
 * @param red red channel
 * @param green green channel
 * @param blue blue channel
 */
public record RgbColor(double red, double green, double blue) {

    public static final RgbColor WHITE = new RgbColor(1.0, 1.0, 1.0);

    private static final Pattern HEX_PATTERN = Pattern.compile("#([0-9a-fA-F]{2})([0-9a-fA-F]{2})([0-9a-fA-F]{2})");
    private static final Pattern RGB_PATTERN =
        Pattern.compile("rgb\\(\\s*(\\d+(?:\\.\\d+)?)\\s*,\\s*(\\d+(?:\\.\\d+)?)\\s*,\\s*(\\d+(?:\\.\\d+)?)\\s*\\)");

    public RgbColor {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException("Color channels must be within 0..1");
        }
    }

    /**
     * Parses {@code #rrggbb} or {@code rgb(r, g, b)} (0..255 channels); anything else is white.
     *
     * @param colorText color as configured by the chat client
     * @return parsed color, never null
     */
    public static RgbColor parse(String colorText) {
        if (colorText == null) {
            return WHITE;
        }
        String trimmed = colorText.trim();
        Matcher hexMatcher = HEX_PATTERN.matcher(trimmed);
        if (hexMatcher.matches()) {
            return fromChannels(
                Integer.parseInt(hexMatcher.group(1), 16),
                Integer.parseInt(hexMatcher.group(2), 16),
                Integer.parseInt(hexMatcher.group(3), 16));
        }
        Matcher rgbMatcher = RGB_PATTERN.matcher(trimmed);
        if (rgbMatcher.matches()) {
            double red = Double.parseDouble(rgbMatcher.group(1));
            double green = Double.parseDouble(rgbMatcher.group(2));
            double blue = Double.parseDouble(rgbMatcher.group(3));
            if (red <= 255 && green <= 255 && blue <= 255) {
                return new RgbColor(red / 255, green / 255, blue / 255);
            }
        }
        return WHITE;
    }

    private static RgbColor fromChannels(int red, int green, int blue) {
        return new RgbColor(red / 255.0, green / 255.0, blue / 255.0);
    }

    /**
     * Formats the color for {@code \color[rgb]{...}}, e.g. {@code 1.000,0.500,0.000}.
     */
    public String toLatexRgb() {
        return String.format(Locale.ROOT, "%.3f,%.3f,%.3f", red, green, blue);
    }

    private static boolean inRange(double channel) {
        return channel >= 0.0 && channel <= 1.0;
    }
}
