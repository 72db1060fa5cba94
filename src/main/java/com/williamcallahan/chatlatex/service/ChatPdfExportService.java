package com.williamcallahan.chatlatex.service;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.config.ExportConfig;
import com.williamcallahan.chatlatex.domain.latex.CompilationResult;
import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import com.williamcallahan.chatlatex.domain.latex.ExportResult;
import com.williamcallahan.chatlatex.service.latex.LatexCompilationException;
import com.williamcallahan.chatlatex.service.latex.LatexCompiler;
import com.williamcallahan.chatlatex.service.latex.LatexDocumentAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Exports a conversation to PDF.
 *
 * <p>The document is compiled in a private temporary directory, once per configured pass, and
 * the PDF is moved to its destination only after the last pass succeeds. On failure nothing is
 * written to the destination; the LaTeX source and compiler log are copied to the debug
 * directory instead.</p>
 */
@Service
public class ChatPdfExportService {

    private static final Logger logger = LoggerFactory.getLogger(ChatPdfExportService.class);
    private static final DateTimeFormatter DEBUG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.ROOT);

    private final LatexDocumentAssembler documentAssembler;
    private final LatexCompiler latexCompiler;
    private final FileOperationsService fileOperations;
    private final ExportConfig exportConfig;

    public ChatPdfExportService(LatexDocumentAssembler documentAssembler, LatexCompiler latexCompiler,
                                FileOperationsService fileOperations, AppProperties appProperties) {
        this.documentAssembler = documentAssembler;
        this.latexCompiler = latexCompiler;
        this.fileOperations = fileOperations;
        this.exportConfig = appProperties.getExport();
    }

    /**
     * Assembles, compiles and writes the PDF.
     *
     * @param request conversation to export
     * @param destination PDF path; only written on success
     * @return export outcome, never null
     */
    public ExportResult export(ConversationExportRequest request, Path destination) {
        String texSource = documentAssembler.assemble(request);
        return compileToPdf(texSource, destination);
    }

    /**
     * Compiles an assembled document and writes the PDF.
     *
     * @param texSource complete LaTeX document
     * @param destination PDF path; only written on success
     * @return export outcome, never null
     */
    public ExportResult compileToPdf(String texSource, Path destination) {
        Path workingDirectory = null;
        try {
            workingDirectory = Files.createTempDirectory("chat-export-");
            CompilationResult lastPass = null;
            for (int pass = 1; pass <= exportConfig.getCompilePasses(); pass++) {
                lastPass = latexCompiler.compile(texSource, workingDirectory);
                if (!lastPass.success()) {
                    logger.warn("LaTeX pass {} failed with exit code {}", pass, lastPass.exitCode());
                    return retainFailure(texSource, lastPass.log(),
                        "LaTeX compilation failed on pass " + pass + " (exit code " + lastPass.exitCode() + ")");
                }
            }
            if (lastPass == null || !fileOperations.fileExists(lastPass.pdfPath())) {
                return retainFailure(texSource, "", "Compiler reported success but produced no PDF");
            }
            fileOperations.moveReplacing(lastPass.pdfPath(), destination);
            logger.info("Exported conversation to {}", destination);
            return ExportResult.exported(destination);
        } catch (LatexCompilationException compilationException) {
            logger.error("LaTeX compiler could not run", compilationException);
            return retainFailure(texSource, compilationException.getMessage(), compilationException.getMessage());
        } catch (IOException ioException) {
            logger.error("PDF export failed", ioException);
            return retainFailure(texSource, ioException.getMessage(), "PDF export failed: " + ioException.getMessage());
        } finally {
            fileOperations.deleteRecursively(workingDirectory);
        }
    }

    private ExportResult retainFailure(String texSource, String compilerLog, String message) {
        String baseName = exportConfig.getJobName() + "_" + LocalDateTime.now().format(DEBUG_STAMP);
        Path debugDirectory = Path.of(exportConfig.getDebugDir());
        Path retainedSource = debugDirectory.resolve(baseName + ".tex");
        try {
            fileOperations.saveTextFile(retainedSource, texSource);
            if (compilerLog != null && !compilerLog.isBlank()) {
                fileOperations.saveTextFile(debugDirectory.resolve(baseName + ".log"), compilerLog);
            }
            logger.warn("{}; source kept at {}", message, retainedSource);
            return ExportResult.failed(message, retainedSource);
        } catch (IOException ioException) {
            logger.error("Could not keep failing LaTeX source in {}", debugDirectory, ioException);
            return ExportResult.failed(message, null);
        }
    }
}
