package com.williamcallahan.chatlatex.cli;

import com.williamcallahan.chatlatex.ChatLatexApplication;
import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import com.williamcallahan.chatlatex.domain.latex.ExportResult;
import com.williamcallahan.chatlatex.service.ChatPdfExportService;
import com.williamcallahan.chatlatex.service.ConversationHistoryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exports a saved conversation to PDF from the command line.
 *
 * <p>Usage: {@code ChatPdfExporter <history.json> <output.pdf> [title]}. Starts the application
 * context without the web server and exits with status 1 when the export fails.</p>
 */
public class ChatPdfExporter {
    private static final Logger log = LoggerFactory.getLogger(ChatPdfExporter.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final ConversationHistoryReader historyReader;
    private final ChatPdfExportService exportService;

    public ChatPdfExporter(ConversationHistoryReader historyReader, ChatPdfExportService exportService) {
        this.historyReader = historyReader;
        this.exportService = exportService;
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 3) {
            log.error("Usage: ChatPdfExporter <history.json> <output.pdf> [title]");
            System.exit(EXIT_USAGE);
        }
        int exitCode;
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(ChatLatexApplication.class)
                .web(WebApplicationType.NONE)
                .run(args)) {
            ChatPdfExporter exporter = new ChatPdfExporter(
                context.getBean(ConversationHistoryReader.class),
                context.getBean(ChatPdfExportService.class));
            exitCode = exporter.run(args);
        }
        System.exit(exitCode);
    }

    /**
     * Runs one export.
     *
     * @param args history file, output PDF and optional title
     * @return process exit code
     */
    int run(String[] args) {
        if (args.length < 2 || args.length > 3) {
            log.error("Usage: ChatPdfExporter <history.json> <output.pdf> [title]");
            return EXIT_USAGE;
        }
        Path historyFile = Path.of(args[0]);
        Path outputFile = Path.of(args[1]);
        String title = args.length == 3 ? args[2] : null;

        ConversationExportRequest request;
        try {
            request = historyReader.read(historyFile, title);
        } catch (IOException e) {
            log.error("Could not read conversation {}: {}", historyFile, e.getMessage());
            return EXIT_FAILED;
        }
        log.info("Exporting {} messages from {} to {}", request.messages().size(), historyFile, outputFile);

        ExportResult result = exportService.export(request, outputFile);
        if (!result.success()) {
            log.error("Export failed: {}", result.message());
            if (result.retainedSourcePath() != null) {
                log.error("LaTeX source kept at {}", result.retainedSourcePath());
            }
            return EXIT_FAILED;
        }
        log.info("PDF written to {}", result.pdfPath());
        return EXIT_OK;
    }
}
