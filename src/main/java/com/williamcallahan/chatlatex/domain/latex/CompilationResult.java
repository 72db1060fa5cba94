package com.williamcallahan.chatlatex.domain.latex;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of one LaTeX compiler pass.
 *
 * @param success true when the compiler exited with status 0 and the PDF exists
 * @param pdfPath produced PDF, null unless successful
 * @param exitCode process exit status, -1 when the process timed out or never started
 * @param log captured compiler output, possibly truncated
 */
public record CompilationResult(boolean success, Path pdfPath, int exitCode, String log) {

    public CompilationResult {
        Objects.requireNonNull(log, "Compiler log cannot be null");
        if (success && pdfPath == null) {
            throw new IllegalArgumentException("A successful compilation must name its PDF");
        }
    }

    public static CompilationResult succeeded(Path pdfPath, String log) {
        return new CompilationResult(true, pdfPath, 0, log);
    }

    public static CompilationResult failed(int exitCode, String log) {
        return new CompilationResult(false, null, exitCode, log);
    }
}
