package com.williamcallahan.chatlatex.service.latex;

/**
 * Signals that the LaTeX compiler could not be run: missing binary, I/O failure or interruption.
 */
public class LatexCompilationException extends RuntimeException {

    public LatexCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
