package com.williamcallahan.chatlatex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.williamcallahan.chatlatex.service.latex.LatexFragmentRenderer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ChatLatexApplicationTests {

    @Autowired
    LatexFragmentRenderer fragmentRenderer;

    @Test
    void contextLoads() {
        assertNotNull(fragmentRenderer);
    }

    @Test
    void renderingRunsThroughPipelineAspect() {
        assertEquals("Hello \\textbf{world}", fragmentRenderer.render("Hello **world**"));
    }
}
