package com.williamcallahan.chatlatex.service.latex;

import java.util.Map;

/**
 * Escapes LaTeX meta-characters and folds typographic punctuation into LaTeX macros.
 *
 * <p>Text containing none of the mapped characters is returned unchanged. Asterisks are left
 * alone so the inline formatter can still see bold and italic markers.</p>
 */
final class LatexEscaper {

    private static final Map<Character, String> REPLACEMENTS = Map.ofEntries(
        Map.entry('\\', "\\textbackslash{}"),
        Map.entry('&', "\\&"),
        Map.entry('%', "\\%"),
        Map.entry('$', "\\$"),
        Map.entry('#', "\\#"),
        Map.entry('_', "\\_"),
        Map.entry('{', "\\{"),
        Map.entry('}', "\\}"),
        Map.entry('~', "\\textasciitilde{}"),
        Map.entry('^', "\\textasciicircum{}"),
        Map.entry('<', "\\textless{}"),
        Map.entry('>', "\\textgreater{}"),
        Map.entry('|', "\\textbar{}"),
        Map.entry('"', "''"),
        Map.entry('‘', "`"),
        Map.entry('’', "'"),
        Map.entry('“', "``"),
        Map.entry('”', "''"),
        Map.entry('•', "\\textbullet{}"),
        Map.entry('—', "\\textemdash{}"),
        Map.entry('–', "\\textendash{}")
    );

    private LatexEscaper() {
    }

    /**
     * Escapes every mapped character in a single left-to-right pass.
     *
     * @param text carrier text without placeholders
     * @return escaped text
     */
    static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = null;
        for (int index = 0; index < text.length(); index++) {
            String replacement = REPLACEMENTS.get(text.charAt(index));
            if (replacement == null) {
                if (escaped != null) {
                    escaped.append(text.charAt(index));
                }
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(text.length() + 16);
                escaped.append(text, 0, index);
            }
            escaped.append(replacement);
        }
        return escaped == null ? text : escaped.toString();
    }

    /**
     * Escapes carrier text while leaving the store's placeholders intact.
     *
     * @param text carrier text with placeholders
     * @param store placeholders known to the current call
     * @return escaped text
     */
    static String escapeCarrier(String text, ProtectedRegionStore store) {
        return store.rewriteCarrier(text, LatexEscaper::escape);
    }
}
