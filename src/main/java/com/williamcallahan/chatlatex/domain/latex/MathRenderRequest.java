package com.williamcallahan.chatlatex.domain.latex;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Requests a bitmap rendering of one TeX expression.
 *
 * @param expression TeX source without math delimiters
 * @param display true for display math, false for inline math
 * @param color text color in {@code #rrggbb} or {@code rgb(r,g,b)} form
 * @param dpi output resolution, zero or negative to use the configured default
 */
public record MathRenderRequest(String expression, boolean display, String color, int dpi) {

    @JsonCreator
    public static MathRenderRequest create(
        @JsonProperty("expression") String expression,
        @JsonProperty("display") Boolean display,
        @JsonProperty("color") String color,
        @JsonProperty("dpi") Integer dpi
    ) {
        return new MathRenderRequest(
            expression == null ? "" : expression,
            display != null && display,
            color == null ? "#ffffff" : color,
            dpi == null ? 0 : dpi);
    }

    public MathRenderRequest {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(color, "Color cannot be null");
    }
}
