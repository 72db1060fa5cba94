package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;

import java.util.Objects;

/**
 * A construct lifted out of carrier text, with the LaTeX it renders to.
 *
 * @param kind construct kind
 * @param source original text of the construct, as the user wrote it
 * @param latex rendered LaTeX, computed when the region is created
 */
record ProtectedRegion(RegionKind kind, String source, String latex) {

    ProtectedRegion {
        Objects.requireNonNull(kind, "Region kind cannot be null");
        Objects.requireNonNull(source, "Region source cannot be null");
        Objects.requireNonNull(latex, "Region latex cannot be null");
    }
}
