package com.williamcallahan.chatlatex.web;

import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import com.williamcallahan.chatlatex.domain.latex.ExportResult;
import com.williamcallahan.chatlatex.domain.latex.LatexFragmentRequest;
import com.williamcallahan.chatlatex.domain.latex.LatexSourceResponse;
import com.williamcallahan.chatlatex.service.ChatPdfExportService;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import com.williamcallahan.chatlatex.service.latex.LatexDocumentAssembler;
import com.williamcallahan.chatlatex.service.latex.LatexFragmentRenderer;
import com.williamcallahan.chatlatex.service.math.LatexToolchainProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * REST endpoints that turn chat messages into LaTeX fragments, whole documents and PDFs.
 */
@RestController
@RequestMapping("/api/latex")
public class LatexController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(LatexController.class);
    private static final String DEFAULT_PDF_NAME = "chat_export";

    private final LatexFragmentRenderer fragmentRenderer;
    private final LatexDocumentAssembler documentAssembler;
    private final ChatPdfExportService exportService;
    private final LatexToolchainProbe toolchainProbe;
    private final FileOperationsService fileOperations;

    public LatexController(LatexFragmentRenderer fragmentRenderer,
                           LatexDocumentAssembler documentAssembler,
                           ChatPdfExportService exportService,
                           LatexToolchainProbe toolchainProbe,
                           FileOperationsService fileOperations,
                           ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.fragmentRenderer = fragmentRenderer;
        this.documentAssembler = documentAssembler;
        this.exportService = exportService;
        this.toolchainProbe = toolchainProbe;
        this.fileOperations = fileOperations;
    }

    /**
     * Converts one message body.
     *
     * @param request {@code {"content": "...", "chatId": "..."}}
     * @return {@code {"latex": "..."}}
     */
    @PostMapping(value = "/fragment",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderFragment(@RequestBody LatexFragmentRequest request) {
        logger.debug("Rendering fragment of length {}", request.content().length());
        return ResponseEntity.ok(new LatexSourceResponse(fragmentRenderer.render(request.content(), request.chatId())));
    }

    /**
     * Assembles a complete document without compiling it.
     *
     * @param request title, chat id and messages
     * @return {@code {"latex": "..."}}
     */
    @PostMapping(value = "/document",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderDocument(@RequestBody ConversationExportRequest request) {
        return ResponseEntity.ok(new LatexSourceResponse(documentAssembler.assemble(request)));
    }

    /**
     * Exports a conversation to PDF.
     *
     * @param request title, chat id and messages
     * @return PDF bytes, or 422 with the retained source path when compilation fails
     */
    @PostMapping(value = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> exportPdf(@RequestBody ConversationExportRequest request) {
        Path pdfFile = null;
        try {
            pdfFile = Files.createTempFile("chat-export-", ".pdf");
            Files.delete(pdfFile);
            ExportResult result = exportService.export(request, pdfFile);
            if (!result.success()) {
                String retained = result.retainedSourcePath() == null ? null : result.retainedSourcePath().toString();
                return unprocessable(result.message(), retained);
            }
            byte[] pdf = Files.readAllBytes(pdfFile);
            String fileName = fileOperations.safeName(request.title().isBlank() ? DEFAULT_PDF_NAME : request.title()) + ".pdf";
            return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(fileName).build().toString())
                .body(pdf);
        } catch (IOException ioException) {
            logger.error("PDF export failed", ioException);
            return handleServiceException(ioException, "export PDF");
        } finally {
            deleteQuietly(pdfFile);
        }
    }

    /**
     * Reports which TeX binaries are installed.
     */
    @GetMapping(value = "/toolchain", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> toolchain() {
        return ResponseEntity.ok(toolchainProbe.probe());
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException deleteFailure) {
            logger.debug("Could not delete temporary PDF {}: {}", file, deleteFailure.getMessage());
        }
    }
}
