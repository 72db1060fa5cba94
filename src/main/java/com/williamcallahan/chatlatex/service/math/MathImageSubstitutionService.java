package com.williamcallahan.chatlatex.service.math;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps {@code \[...\]} and {@code \(...\)} formulas in display text for image tags that point
 * at rendered bitmaps. A formula that fails to render stays as literal text.
 */
@Service
public class MathImageSubstitutionService {

    private static final Pattern DISPLAY_MATH = Pattern.compile("\\\\\\[(.+?)\\\\\\]", Pattern.DOTALL);
    private static final Pattern INLINE_MATH = Pattern.compile("\\\\\\((.+?)\\\\\\)", Pattern.DOTALL);

    private final MathImageCache mathImageCache;
    private final int defaultDpi;

    public MathImageSubstitutionService(MathImageCache mathImageCache, AppProperties appProperties) {
        this.mathImageCache = mathImageCache;
        this.defaultDpi = appProperties.getMath().getDefaultDpi();
    }

    /**
     * Replaces formulas with {@code <img>} tags.
     *
     * @param text display text
     * @param colorText formula color, {@code #rrggbb} or {@code rgb(r,g,b)}
     * @param dpi resolution, zero or negative for the configured default
     * @return text with rendered formulas replaced
     */
    public String substitute(String text, String colorText, int dpi) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        RgbColor color = RgbColor.parse(colorText);
        int effectiveDpi = dpi > 0 ? dpi : defaultDpi;
        String substituted = replaceFormulas(DISPLAY_MATH, text, true, color, effectiveDpi);
        return replaceFormulas(INLINE_MATH, substituted, false, color, effectiveDpi);
    }

    private String replaceFormulas(Pattern pattern, String text, boolean display, RgbColor color, int dpi) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String expression = matcher.group(1).strip();
            Optional<Path> image = expression.isEmpty()
                ? Optional.empty()
                : mathImageCache.renderToFile(expression, display, color, dpi);
            String replacement = image
                .map(path -> "<img src=\"" + path.toAbsolutePath().toString().replace('\\', '/') + "\"/>")
                .orElse(matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
