package com.williamcallahan.chatlatex.service.math;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import com.williamcallahan.chatlatex.support.ExternalCommandRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies the formula document and the latex/dvipng invocations with a stubbed process runner.
 */
class DvipngMathImageRendererTest {

    @Test
    void buildsColoredDisplayDocument() {
        String document = DvipngMathImageRenderer.texDocument("α+1", true, RgbColor.parse("#ff0000"));

        assertTrue(document.contains("\\color[rgb]{1.000,0.000,0.000}"));
        assertTrue(document.contains("\\[\\displaystyle \\alpha +1\\]"));
    }

    @Test
    void inlineDocumentUsesParenDelimiters() {
        assertTrue(DvipngMathImageRenderer.texDocument("x", false, RgbColor.WHITE).contains("\\(x\\)"));
    }

    @Test
    void mapsUnicodeSymbols() {
        assertEquals("\\pi r^2\\leq 90^{\\circ}", DvipngMathImageRenderer.replaceSymbols("πr^2≤90°"));
    }

    @Test
    void runsLatexThenDvipngAtScaledDpi() throws Exception {
        ExternalCommandRunner runner = mock(ExternalCommandRunner.class);
        List<List<String>> commands = new ArrayList<>();
        given(runner.run(anyList(), any(Path.class), any(Duration.class))).willAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            Path workingDirectory = invocation.getArgument(1);
            commands.add(command);
            if (command.get(0).equals("latex")) {
                Files.writeString(workingDirectory.resolve("equation.dvi"), "dvi");
            } else {
                Files.write(workingDirectory.resolve("equation.png"), new byte[] {7, 8});
            }
            return new ExternalCommandRunner.CommandResult(0, "", false);
        });
        DvipngMathImageRenderer renderer =
            new DvipngMathImageRenderer(new AppProperties(), runner, new FileOperationsService());

        Optional<byte[]> png = renderer.render("x", true, RgbColor.WHITE, 200);

        assertArrayEquals(new byte[] {7, 8}, png.orElseThrow());
        verify(runner, times(2)).run(anyList(), any(Path.class), any(Duration.class));
        assertEquals("dvipng", commands.get(1).get(0));
        assertEquals("250", commands.get(1).get(commands.get(1).indexOf("-D") + 1));
    }

    @Test
    void latexFailureYieldsEmpty() throws Exception {
        ExternalCommandRunner runner = mock(ExternalCommandRunner.class);
        given(runner.run(anyList(), any(Path.class), any(Duration.class)))
            .willReturn(new ExternalCommandRunner.CommandResult(1, "! Undefined control sequence.", false));
        DvipngMathImageRenderer renderer =
            new DvipngMathImageRenderer(new AppProperties(), runner, new FileOperationsService());

        assertTrue(renderer.render("\\nope", false, RgbColor.WHITE, 200).isEmpty());
    }
}
