package com.williamcallahan.chatlatex.service.math;

import com.williamcallahan.chatlatex.domain.latex.RgbColor;

import java.util.Optional;

/**
 * Renders a TeX expression to a PNG bitmap for live display.
 *
 * <p>Output depends only on the four arguments, which lets callers cache by their hash.</p>
 */
public interface MathImageRenderer {

    /**
     * Renders one expression.
     *
     * @param expression TeX source without math delimiters
     * @param display display style when true, inline style otherwise
     * @param color text color
     * @param dpi output resolution
     * @return PNG bytes, empty when the expression cannot be rendered
     */
    Optional<byte[]> render(String expression, boolean display, RgbColor color, int dpi);
}
