package com.williamcallahan.chatlatex.domain.math;

/**
 * Display text with rendered formulas replaced by image tags.
 *
 * @param text substituted text
 */
public record MathSubstitutionResponse(String text) {
}
