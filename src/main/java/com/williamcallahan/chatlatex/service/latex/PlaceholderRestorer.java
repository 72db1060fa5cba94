package com.williamcallahan.chatlatex.service.latex;

/**
 * Expands placeholders back into their rendered LaTeX and releases the store.
 */
final class PlaceholderRestorer {

    private PlaceholderRestorer() {
    }

    /**
     * Replaces every known placeholder in one scan of the carrier text, then clears the store.
     *
     * <p>Region LaTeX is fully resolved when the region is created, so substituted LaTeX is
     * never scanned again. Text inside a region that looks like a placeholder stays as written.</p>
     *
     * @param text carrier text with placeholders
     * @param store store of the current call
     * @return final LaTeX
     */
    static String restore(String text, ProtectedRegionStore store) {
        try {
            return store.expandLatex(text);
        } finally {
            store.clear();
        }
    }
}
