package com.williamcallahan.chatlatex.domain.latex;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Document-level outcome of exporting a conversation to PDF.
 *
 * @param success true only when the final PDF exists at {@code pdfPath}
 * @param pdfPath destination PDF, null on failure
 * @param retainedSourcePath LaTeX source kept for diagnosis after a failure, null otherwise
 * @param message human readable summary
 */
public record ExportResult(boolean success, Path pdfPath, Path retainedSourcePath, String message) {

    public ExportResult {
        Objects.requireNonNull(message, "Export message cannot be null");
        if (success && pdfPath == null) {
            throw new IllegalArgumentException("A successful export must name its PDF");
        }
    }

    public static ExportResult exported(Path pdfPath) {
        return new ExportResult(true, pdfPath, null, "Exported " + pdfPath.getFileName());
    }

    public static ExportResult failed(String message, Path retainedSourcePath) {
        return new ExportResult(false, null, retainedSourcePath, message);
    }
}
