package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.CompilationResult;

import java.nio.file.Path;

/**
 * Runs one pass of an external LaTeX compiler.
 */
public interface LatexCompiler {

    /**
     * Writes the source into the working directory and compiles it once.
     *
     * @param texSource complete document
     * @param workingDirectory directory for the source, auxiliary files and PDF; reused across passes
     * @return outcome; successful only when the compiler exited with 0 and the PDF exists
     * @throws LatexCompilationException when the compiler cannot be run at all
     */
    CompilationResult compile(String texSource, Path workingDirectory);
}
