package com.williamcallahan.chatlatex.service.math;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.config.MathRenderConfig;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import com.williamcallahan.chatlatex.support.ExternalCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders formulas with {@code latex} and {@code dvipng}.
 *
 * <p>Each call works in its own temporary directory, so concurrent calls never share files.
 * Display math is rendered at 1.25 times the requested resolution.</p>
 */
@Component
public class DvipngMathImageRenderer implements MathImageRenderer {

    private static final Logger logger = LoggerFactory.getLogger(DvipngMathImageRenderer.class);

    private static final double DISPLAY_SCALE = 1.25;
    private static final String JOB_NAME = "equation";

    private static final String DOCUMENT_TEMPLATE = """
        \\documentclass{article}
        \\usepackage{amsmath}
        \\usepackage{amssymb}
        \\usepackage{xcolor}
        \\pagestyle{empty}
        \\begin{document}
        \\color[rgb]{%s}
        %s
        \\end{document}
        """;

    /** Unicode math symbols replaced by their commands before typesetting. */
    private static final Map<String, String> SYMBOL_COMMANDS = new LinkedHashMap<>();

    static {
        SYMBOL_COMMANDS.put("Ω", "\\Omega ");
        SYMBOL_COMMANDS.put("π", "\\pi ");
        SYMBOL_COMMANDS.put("μ", "\\mu ");
        SYMBOL_COMMANDS.put("θ", "\\theta ");
        SYMBOL_COMMANDS.put("α", "\\alpha ");
        SYMBOL_COMMANDS.put("β", "\\beta ");
        SYMBOL_COMMANDS.put("γ", "\\gamma ");
        SYMBOL_COMMANDS.put("δ", "\\delta ");
        SYMBOL_COMMANDS.put("ε", "\\epsilon ");
        SYMBOL_COMMANDS.put("λ", "\\lambda ");
        SYMBOL_COMMANDS.put("σ", "\\sigma ");
        SYMBOL_COMMANDS.put("τ", "\\tau ");
        SYMBOL_COMMANDS.put("φ", "\\phi ");
        SYMBOL_COMMANDS.put("ω", "\\omega ");
        SYMBOL_COMMANDS.put("±", "\\pm ");
        SYMBOL_COMMANDS.put("∑", "\\sum ");
        SYMBOL_COMMANDS.put("∫", "\\int ");
        SYMBOL_COMMANDS.put("∞", "\\infty ");
        SYMBOL_COMMANDS.put("≈", "\\approx ");
        SYMBOL_COMMANDS.put("≠", "\\neq ");
        SYMBOL_COMMANDS.put("≤", "\\leq ");
        SYMBOL_COMMANDS.put("≥", "\\geq ");
        SYMBOL_COMMANDS.put("×", "\\times ");
        SYMBOL_COMMANDS.put("÷", "\\div ");
        SYMBOL_COMMANDS.put("→", "\\rightarrow ");
        SYMBOL_COMMANDS.put("←", "\\leftarrow ");
        SYMBOL_COMMANDS.put("↔", "\\leftrightarrow ");
        SYMBOL_COMMANDS.put("∂", "\\partial ");
        SYMBOL_COMMANDS.put("∇", "\\nabla ");
        SYMBOL_COMMANDS.put("°", "^{\\circ}");
    }

    private final MathRenderConfig mathConfig;
    private final ExternalCommandRunner commandRunner;
    private final FileOperationsService fileOperations;

    public DvipngMathImageRenderer(AppProperties appProperties, ExternalCommandRunner commandRunner,
                                   FileOperationsService fileOperations) {
        this.mathConfig = appProperties.getMath();
        this.commandRunner = commandRunner;
        this.fileOperations = fileOperations;
    }

    @Override
    public Optional<byte[]> render(String expression, boolean display, RgbColor color, int dpi) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        Path workingDirectory = null;
        try {
            workingDirectory = Files.createTempDirectory("formula-");
            fileOperations.saveTextFile(workingDirectory.resolve(JOB_NAME + ".tex"), texDocument(expression, display, color));

            ExternalCommandRunner.CommandResult latexRun = commandRunner.run(
                List.of(mathConfig.getLatexCommand(), "-interaction=nonstopmode", JOB_NAME + ".tex"),
                workingDirectory, mathConfig.getRenderTimeout());
            Path dviFile = workingDirectory.resolve(JOB_NAME + ".dvi");
            if (!latexRun.succeeded() || !fileOperations.fileExists(dviFile)) {
                logger.debug("latex could not typeset formula (exit {}): {}", latexRun.exitCode(), expression);
                return Optional.empty();
            }

            int effectiveDpi = display ? (int) Math.round(dpi * DISPLAY_SCALE) : dpi;
            Path pngFile = workingDirectory.resolve(JOB_NAME + ".png");
            ExternalCommandRunner.CommandResult dvipngRun = commandRunner.run(
                List.of(mathConfig.getDvipngCommand(), "-D", Integer.toString(effectiveDpi), "-T", "tight",
                    "-bg", "Transparent", "-o", pngFile.getFileName().toString(), dviFile.getFileName().toString()),
                workingDirectory, mathConfig.getRenderTimeout());
            if (!dvipngRun.succeeded() || !fileOperations.fileExists(pngFile)) {
                logger.debug("dvipng failed (exit {}) for formula: {}", dvipngRun.exitCode(), expression);
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(pngFile));
        } catch (IOException ioException) {
            logger.warn("Formula rendering failed: {}", ioException.getMessage());
            return Optional.empty();
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            logger.warn("Formula rendering interrupted");
            return Optional.empty();
        } finally {
            fileOperations.deleteRecursively(workingDirectory);
        }
    }

    /**
     * Builds the standalone document for one formula.
     */
    static String texDocument(String expression, boolean display, RgbColor color) {
        String body = replaceSymbols(expression);
        String mathBlock = display ? "\\[\\displaystyle " + body + "\\]" : "\\(" + body + "\\)";
        return String.format(Locale.ROOT, DOCUMENT_TEMPLATE, color.toLatexRgb(), mathBlock);
    }

    static String replaceSymbols(String expression) {
        String replaced = expression;
        for (Map.Entry<String, String> symbol : SYMBOL_COMMANDS.entrySet()) {
            replaced = replaced.replace(symbol.getKey(), symbol.getValue());
        }
        return replaced;
    }
}
