package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder registry for one transformation call.
 *
 * <p>Placeholders have the form {@code @@KIND_n@@}; {@code n} comes from a counter owned by the
 * store, so two calls never share ids. A store is not thread-safe and must not outlive the call
 * that created it.</p>
 */
final class ProtectedRegionStore {

    /** Shape of any placeholder, known to this store or not. */
    static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("@@([A-Z]+)_(\\d+)@@");

    private static final String PLACEHOLDER_FENCE = "@@";
    private static final int MAX_RESERVED_ID_DIGITS = 9;

    private final Map<String, ProtectedRegion> regions = new LinkedHashMap<>();
    private int nextId;

    /**
     * A run of carrier text or a single known placeholder.
     *
     * @param text token text
     * @param region region behind the placeholder, null for carrier text
     */
    record TextToken(String text, ProtectedRegion region) {

        boolean isPlaceholder() {
            return region != null;
        }
    }

    /**
     * Registers a region and returns its placeholder.
     *
     * @param kind region kind
     * @param source original construct text
     * @param latex rendered LaTeX
     * @return new placeholder, unique within this store
     */
    String protect(RegionKind kind, String source, String latex) {
        String placeholder = PLACEHOLDER_FENCE + kind.name() + "_" + nextId++ + PLACEHOLDER_FENCE;
        regions.put(placeholder, new ProtectedRegion(kind, source, latex));
        return placeholder;
    }

    /**
     * Moves the id counter past every placeholder-shaped id in the input, so no generated
     * placeholder spells the same text as something the user wrote.
     *
     * @param text raw input of the call
     */
    void reserveIdsUsedIn(String text) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group(2);
            // ids beyond nine digits are out of the counter's reach
            if (digits.length() <= MAX_RESERVED_ID_DIGITS) {
                nextId = Math.max(nextId, Integer.parseInt(digits) + 1);
            }
        }
    }

    ProtectedRegion lookup(String placeholder) {
        return regions.get(placeholder);
    }

    boolean isEmpty() {
        return regions.isEmpty();
    }

    int size() {
        return regions.size();
    }

    void clear() {
        regions.clear();
    }

    /**
     * Splits text into carrier runs and known placeholders.
     *
     * <p>Every {@code @@} position is tried, so carrier text that happens to end in
     * {@code @@X_1} cannot swallow the fence of a real placeholder that follows it.</p>
     *
     * @param text carrier text containing placeholders
     * @return tokens in order; their concatenation equals {@code text}
     */
    List<TextToken> tokenize(String text) {
        List<TextToken> tokens = new ArrayList<>();
        if (text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        int carrierStart = 0;
        int scanIndex = text.indexOf(PLACEHOLDER_FENCE);
        while (scanIndex >= 0 && !regions.isEmpty()) {
            matcher.region(scanIndex, text.length());
            ProtectedRegion region = matcher.lookingAt() ? regions.get(matcher.group()) : null;
            if (region == null) {
                scanIndex = text.indexOf(PLACEHOLDER_FENCE, scanIndex + 1);
                continue;
            }
            if (scanIndex > carrierStart) {
                tokens.add(new TextToken(text.substring(carrierStart, scanIndex), null));
            }
            tokens.add(new TextToken(matcher.group(), region));
            carrierStart = matcher.end();
            scanIndex = text.indexOf(PLACEHOLDER_FENCE, carrierStart);
        }
        if (carrierStart < text.length()) {
            tokens.add(new TextToken(text.substring(carrierStart), null));
        }
        return tokens;
    }

    /**
     * Rewrites carrier runs and leaves placeholders untouched.
     *
     * @param text carrier text containing placeholders
     * @param carrierRewriter transformation for each carrier run
     * @return rewritten text
     */
    String rewriteCarrier(String text, Function<String, String> carrierRewriter) {
        StringBuilder rewritten = new StringBuilder(text.length() + 16);
        for (TextToken token : tokenize(text)) {
            rewritten.append(token.isPlaceholder() ? token.text() : carrierRewriter.apply(token.text()));
        }
        return rewritten.toString();
    }

    /**
     * Replaces known placeholders with the original source of their region, recursively.
     *
     * <p>Math and code regions use this so their content stays byte-identical to what the user
     * wrote even when an earlier pass already lifted part of it.</p>
     *
     * @param text text that may contain placeholders
     * @return text with every known placeholder replaced by its source
     */
    String expandSource(String text) {
        return expand(text, ProtectedRegion::source);
    }

    /**
     * Replaces known placeholders with their rendered LaTeX.
     *
     * @param text text that may contain placeholders
     * @return text with every known placeholder replaced by its LaTeX
     */
    String expandLatex(String text) {
        return expand(text, ProtectedRegion::latex);
    }

    private String expand(String text, Function<ProtectedRegion, String> valueOf) {
        StringBuilder expanded = new StringBuilder(text.length() + 32);
        for (TextToken token : tokenize(text)) {
            expanded.append(token.isPlaceholder() ? valueOf.apply(token.region()) : token.text());
        }
        return expanded.toString();
    }
}
