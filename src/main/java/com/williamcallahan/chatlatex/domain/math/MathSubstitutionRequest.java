package com.williamcallahan.chatlatex.domain.math;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Display text whose {@code \[...\]} and {@code \(...\)} formulas should become image tags.
 *
 * @param text message text as shown in the chat view
 * @param color formula color
 * @param dpi resolution, zero or negative for the configured default
 */
public record MathSubstitutionRequest(String text, String color, int dpi) {

    @JsonCreator
    public static MathSubstitutionRequest create(
        @JsonProperty("text") String text,
        @JsonProperty("color") String color,
        @JsonProperty("dpi") Integer dpi
    ) {
        return new MathSubstitutionRequest(text == null ? "" : text, color == null ? "#ffffff" : color, dpi == null ? 0 : dpi);
    }

    public MathSubstitutionRequest {
        Objects.requireNonNull(text, "Text cannot be null");
        Objects.requireNonNull(color, "Color cannot be null");
    }
}
