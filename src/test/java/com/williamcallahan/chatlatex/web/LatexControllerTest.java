package com.williamcallahan.chatlatex.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import com.williamcallahan.chatlatex.domain.latex.ExportResult;
import com.williamcallahan.chatlatex.domain.math.ToolchainStatus;
import com.williamcallahan.chatlatex.service.ChatPdfExportService;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import com.williamcallahan.chatlatex.service.latex.LatexDocumentAssembler;
import com.williamcallahan.chatlatex.service.latex.LatexFragmentRenderer;
import com.williamcallahan.chatlatex.service.math.LatexToolchainProbe;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies the LaTeX endpoints under WebMvcTest.
 */
@WebMvcTest(controllers = LatexController.class)
@Import(ExceptionResponseBuilder.class)
class LatexControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    LatexFragmentRenderer fragmentRenderer;

    @MockitoBean
    LatexDocumentAssembler documentAssembler;

    @MockitoBean
    ChatPdfExportService exportService;

    @MockitoBean
    LatexToolchainProbe toolchainProbe;

    @MockitoBean
    FileOperationsService fileOperations;

    @Test
    void rendersFragment() throws Exception {
        given(fragmentRenderer.render("**x**", "chat1")).willReturn("\\textbf{x}");

        mockMvc.perform(post("/api/latex/fragment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"**x**\", \"chatId\": \"chat1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.latex").value("\\textbf{x}"));
    }

    @Test
    void rendersDocument() throws Exception {
        given(documentAssembler.assemble(any(ConversationExportRequest.class))).willReturn("\\documentclass{article}");

        mockMvc.perform(post("/api/latex/document")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"T\", \"messages\": [{\"role\": \"user\", \"content\": \"hi\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.latex").value("\\documentclass{article}"));
    }

    @Test
    void exportReturnsPdfAttachment() throws Exception {
        given(fileOperations.safeName("My Chat")).willReturn("My_Chat");
        given(exportService.export(any(ConversationExportRequest.class), any(Path.class))).willAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            Files.writeString(destination, "%PDF-1.5");
            return ExportResult.exported(destination);
        });

        mockMvc.perform(post("/api/latex/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"My Chat\", \"messages\": []}"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_PDF))
            .andExpect(header().string("Content-Disposition", "attachment; filename=\"My_Chat.pdf\""))
            .andExpect(content().string("%PDF-1.5"));
    }

    @Test
    void failedExportIsUnprocessableWithRetainedSource() throws Exception {
        given(exportService.export(any(ConversationExportRequest.class), any(Path.class)))
            .willReturn(ExportResult.failed("LaTeX compilation failed on pass 1 (exit code 1)", Path.of("/debug/chat_export.tex")));

        mockMvc.perform(post("/api/latex/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\": []}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("LaTeX compilation failed on pass 1 (exit code 1)"))
            .andExpect(jsonPath("$.details").value("/debug/chat_export.tex"));
    }

    @Test
    void reportsToolchain() throws Exception {
        given(toolchainProbe.probe()).willReturn(new ToolchainStatus(true, false, true));

        mockMvc.perform(get("/api/latex/toolchain"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.latexAvailable").value(true))
            .andExpect(jsonPath("$.dvipngAvailable").value(false))
            .andExpect(jsonPath("$.pdflatexAvailable").value(true));
    }

    @Test
    void exportUsesDefaultNameWithoutTitle() throws Exception {
        given(fileOperations.safeName(eq("chat_export"))).willReturn("chat_export");
        given(exportService.export(any(ConversationExportRequest.class), any(Path.class))).willAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            Files.writeString(destination, "%PDF");
            return ExportResult.exported(destination);
        });

        mockMvc.perform(post("/api/latex/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\": []}"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", "attachment; filename=\"chat_export.pdf\""));
    }
}
