package com.williamcallahan.chatlatex.support;

/**
 * Locale-independent ASCII helpers for role tags, fence language tags and command names.
 *
 * <p>{@code String.toLowerCase()} follows the default locale (the Turkish dotless i being the
 * classic trap), so identifiers coming out of chat text are folded here instead.</p>
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
    }

    /**
     * Lowercases ASCII letters only.
     *
     * @param text identifier to fold (may be null)
     * @return folded text, empty string for null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder folded = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            folded.append(current >= 'A' && current <= 'Z' ? (char) (current + CASE_OFFSET) : current);
        }
        return folded.toString();
    }

    /**
     * Returns whether the character is an ASCII letter, the only characters allowed in a TeX
     * control word.
     */
    public static boolean isAsciiLetter(char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z');
    }
}
