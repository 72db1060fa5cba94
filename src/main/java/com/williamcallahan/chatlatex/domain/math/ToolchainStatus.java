package com.williamcallahan.chatlatex.domain.math;

/**
 * Which TeX binaries answered a {@code --version} probe.
 *
 * @param latexAvailable {@code latex} for formula rendering
 * @param dvipngAvailable {@code dvipng} for formula rendering
 * @param pdflatexAvailable {@code pdflatex} for PDF export
 */
public record ToolchainStatus(boolean latexAvailable, boolean dvipngAvailable, boolean pdflatexAvailable) {

    /**
     * Formula bitmaps need both {@code latex} and {@code dvipng}.
     */
    public boolean mathRenderingAvailable() {
        return latexAvailable && dvipngAvailable;
    }
}
