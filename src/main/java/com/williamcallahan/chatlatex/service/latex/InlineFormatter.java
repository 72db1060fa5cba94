package com.williamcallahan.chatlatex.service.latex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts markdown bullet, bold and italic markers in escaped carrier text.
 *
 * <p>Runs after escaping, so the produced braces and backslashes are never escaped again.
 * Code spans are already placeholders by this point and cannot be matched.</p>
 */
final class InlineFormatter {

    private static final Pattern BULLET_PATTERN = Pattern.compile("(?m)^([ \\t]*)[-*+][ \\t]+");
    private static final Pattern BOLD_PATTERN = Pattern.compile("\\*\\*([^*`\\n]+?)\\*\\*");
    private static final Pattern ITALIC_PATTERN =
        Pattern.compile("(?<![*\\\\])\\*(?!\\s)([^*`\\n]+?)(?<!\\s)\\*(?!\\*)");

    private InlineFormatter() {
    }

    /**
     * Applies bullets, then bold, then italic.
     *
     * @param text escaped carrier text, placeholders allowed
     * @return formatted text
     */
    static String format(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String formatted = BULLET_PATTERN.matcher(text).replaceAll("$1\\\\textbullet{} ");
        formatted = wrap(BOLD_PATTERN, formatted, "\\textbf{");
        return wrap(ITALIC_PATTERN, formatted, "\\textit{");
    }

    private static String wrap(Pattern pattern, String text, String commandOpening) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder result = new StringBuilder(text.length() + 16);
        do {
            matcher.appendReplacement(result, Matcher.quoteReplacement(commandOpening + matcher.group(1) + "}"));
        } while (matcher.find());
        matcher.appendTail(result);
        return result.toString();
    }
}
