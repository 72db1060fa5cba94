package com.williamcallahan.chatlatex.domain.latex;

import java.util.Objects;

/**
 * LaTeX produced for a fragment or a whole document.
 *
 * @param latex generated source
 */
public record LatexSourceResponse(String latex) {

    public LatexSourceResponse {
        Objects.requireNonNull(latex, "LaTeX source cannot be null");
    }
}
