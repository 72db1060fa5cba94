package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.config.ExportConfig;
import com.williamcallahan.chatlatex.domain.latex.CompilationResult;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import com.williamcallahan.chatlatex.support.ExternalCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Compiles documents with {@code pdflatex} in non-stop mode.
 */
@Component
public class PdflatexCompiler implements LatexCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PdflatexCompiler.class);

    private final ExportConfig exportConfig;
    private final ExternalCommandRunner commandRunner;
    private final FileOperationsService fileOperations;

    public PdflatexCompiler(AppProperties appProperties, ExternalCommandRunner commandRunner,
                            FileOperationsService fileOperations) {
        this.exportConfig = appProperties.getExport();
        this.commandRunner = commandRunner;
        this.fileOperations = fileOperations;
    }

    @Override
    public CompilationResult compile(String texSource, Path workingDirectory) {
        String jobName = exportConfig.getJobName();
        Path texFile = workingDirectory.resolve(jobName + ".tex");
        Path pdfFile = workingDirectory.resolve(jobName + ".pdf");
        List<String> command = List.of(
            exportConfig.getCompilerCommand(),
            "-interaction=nonstopmode",
            "-jobname=" + jobName,
            texFile.getFileName().toString());
        try {
            fileOperations.saveTextFile(texFile, texSource);
            ExternalCommandRunner.CommandResult result =
                commandRunner.run(command, workingDirectory, exportConfig.getCompileTimeout());
            if (result.timedOut()) {
                return CompilationResult.failed(-1, "Compiler timed out after " + exportConfig.getCompileTimeout()
                    + "\n" + result.output());
            }
            if (result.exitCode() != 0 || !fileOperations.fileExists(pdfFile)) {
                logger.warn("{} exited with {} (pdf present: {})", command.get(0), result.exitCode(),
                    fileOperations.fileExists(pdfFile));
                return CompilationResult.failed(result.exitCode(), result.output());
            }
            return CompilationResult.succeeded(pdfFile, result.output());
        } catch (IOException ioException) {
            throw new LatexCompilationException("Could not run " + command.get(0) + ": " + ioException.getMessage(), ioException);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new LatexCompilationException("Interrupted while compiling " + texFile, interruptedException);
        }
    }
}
