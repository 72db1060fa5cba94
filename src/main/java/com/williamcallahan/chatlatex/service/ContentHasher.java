package com.williamcallahan.chatlatex.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Component
public class ContentHasher {

    private static final int FORMULA_KEY_LENGTH = 16;

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    public String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Generates the cache key of a rendered formula from everything that affects its pixels.
     *
     * @param expression TeX expression
     * @param display display or inline math
     * @param latexColor color in {@code r,g,b} form
     * @param dpi output resolution
     * @return first 16 hex characters of the SHA-256 of the combined inputs
     */
    public String formulaKey(String expression, boolean display, String latexColor, int dpi) {
        String hashInput = expression + "_" + display + "_" + latexColor + "_" + dpi;
        return sha256(hashInput).substring(0, FORMULA_KEY_LENGTH);
    }
}
