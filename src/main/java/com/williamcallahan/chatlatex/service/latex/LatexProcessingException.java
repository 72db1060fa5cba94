package com.williamcallahan.chatlatex.service.latex;

/**
 * Signals an internal failure while converting chat markdown to LaTeX.
 *
 * <p>Never escapes the fragment renderer: the failing segment is rendered as escaped text.</p>
 */
public class LatexProcessingException extends IllegalStateException {

    /**
     * Creates a processing exception with a failure summary.
     *
     * @param message failure summary
     */
    public LatexProcessingException(String message) {
        super(message);
    }

    /**
     * Creates a processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public LatexProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
