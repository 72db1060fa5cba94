package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.ChatMessage;
import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import com.williamcallahan.chatlatex.domain.latex.MessageRole;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Wraps rendered messages into a complete, compilable LaTeX document.
 *
 * <p>Each message gets a bold header in its role color. System messages are left out. An
 * optional title block with the generation time sits under the preamble.</p>
 */
@Service
public class LatexDocumentAssembler {

    private static final DateTimeFormatter GENERATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    static final String PREAMBLE = """
        \\documentclass{article}
        \\usepackage[utf8]{inputenc}
        \\usepackage{geometry}
        \\usepackage{xcolor}
        \\usepackage{parskip}
        \\usepackage{listings}
        \\usepackage{fancyhdr}
        \\usepackage{amsmath}
        \\usepackage{amssymb}
        \\usepackage{graphicx}
        \\usepackage{textcomp}
        \\usepackage[hidelinks]{hyperref}

        % Unicode symbols that show up in chat text outside math mode
        \\DeclareUnicodeCharacter{03A9}{\\ensuremath{\\Omega}}
        \\DeclareUnicodeCharacter{03C0}{\\ensuremath{\\pi}}
        \\DeclareUnicodeCharacter{03BC}{\\ensuremath{\\mu}}
        \\DeclareUnicodeCharacter{03B8}{\\ensuremath{\\theta}}
        \\DeclareUnicodeCharacter{03B1}{\\ensuremath{\\alpha}}
        \\DeclareUnicodeCharacter{03B2}{\\ensuremath{\\beta}}
        \\DeclareUnicodeCharacter{03B3}{\\ensuremath{\\gamma}}
        \\DeclareUnicodeCharacter{03C3}{\\ensuremath{\\sigma}}
        \\DeclareUnicodeCharacter{03C6}{\\ensuremath{\\phi}}
        \\DeclareUnicodeCharacter{2211}{\\ensuremath{\\sum}}
        \\DeclareUnicodeCharacter{222B}{\\ensuremath{\\int}}
        \\DeclareUnicodeCharacter{221E}{\\ensuremath{\\infty}}
        \\DeclareUnicodeCharacter{2248}{\\ensuremath{\\approx}}
        \\DeclareUnicodeCharacter{2260}{\\ensuremath{\\neq}}
        \\DeclareUnicodeCharacter{2264}{\\ensuremath{\\leq}}
        \\DeclareUnicodeCharacter{2265}{\\ensuremath{\\geq}}
        \\DeclareUnicodeCharacter{00B1}{\\ensuremath{\\pm}}
        \\DeclareUnicodeCharacter{00D7}{\\ensuremath{\\times}}
        \\DeclareUnicodeCharacter{00F7}{\\ensuremath{\\div}}
        \\DeclareUnicodeCharacter{2192}{\\ensuremath{\\rightarrow}}
        \\DeclareUnicodeCharacter{2190}{\\ensuremath{\\leftarrow}}
        \\DeclareUnicodeCharacter{2194}{\\ensuremath{\\leftrightarrow}}
        \\DeclareUnicodeCharacter{2202}{\\ensuremath{\\partial}}
        \\DeclareUnicodeCharacter{2207}{\\ensuremath{\\nabla}}
        \\DeclareUnicodeCharacter{00B0}{\\ensuremath{^{\\circ}}}
        \\DeclareUnicodeCharacter{00B9}{\\ensuremath{^{1}}}
        \\DeclareUnicodeCharacter{00B2}{\\ensuremath{^{2}}}
        \\DeclareUnicodeCharacter{00B3}{\\ensuremath{^{3}}}

        \\DeclareGraphicsExtensions{.pdf,.png,.jpg,.jpeg}

        \\geometry{margin=1in}
        \\definecolor{usercolor}{RGB}{70, 130, 180}
        \\definecolor{assistantcolor}{RGB}{60, 179, 113}
        \\definecolor{codebg}{RGB}{40, 44, 52}
        \\definecolor{codetext}{RGB}{171, 178, 191}

        \\lstset{
            basicstyle=\\ttfamily\\small\\color{codetext},
            backgroundcolor=\\color{codebg},
            breaklines=true,
            frame=single,
            numbers=left,
            numberstyle=\\tiny\\color{codetext},
            showstringspaces=false,
            columns=flexible,
            keepspaces=true,
            mathescape=false,
            texcl=false,
            upquote=true,
            xleftmargin=\\dimexpr\\fboxsep+1pt\\relax,
            xrightmargin=\\dimexpr\\fboxsep+1pt\\relax,
            framexleftmargin=\\dimexpr\\fboxsep+.4pt\\relax,
            resetmargins=true
        }

        \\pagestyle{fancy}
        \\fancyhf{}
        \\rhead{Chat Export}
        \\lhead{\\thepage}

        \\allowdisplaybreaks
        \\setlength{\\jot}{10pt}

        \\begin{document}
        """;

    static final String DOCUMENT_END = "\\end{document}\n";

    private final LatexFragmentRenderer fragmentRenderer;
    private final Clock clock;

    @Autowired
    public LatexDocumentAssembler(LatexFragmentRenderer fragmentRenderer) {
        this(fragmentRenderer, Clock.systemDefaultZone());
    }

    LatexDocumentAssembler(LatexFragmentRenderer fragmentRenderer, Clock clock) {
        this.fragmentRenderer = fragmentRenderer;
        this.clock = clock;
    }

    /**
     * Assembles the document for an export request.
     *
     * @param request title, chat id and messages
     * @return complete LaTeX source
     */
    public String assemble(ConversationExportRequest request) {
        return assemble(request.title(), request.chatId(), request.messages());
    }

    /**
     * Assembles a document from messages in conversation order.
     *
     * @param title optional title, blank for none
     * @param chatId chat id used to resolve images, may be null
     * @param messages conversation messages
     * @return complete LaTeX source
     */
    public String assemble(String title, String chatId, List<ChatMessage> messages) {
        StringBuilder document = new StringBuilder(PREAMBLE);
        if (title != null && !title.isBlank()) {
            document.append(titleBlock(title.strip()));
        }
        for (ChatMessage message : messages) {
            if (message.messageRole() == MessageRole.SYSTEM) {
                continue;
            }
            document.append(messageBlock(message, chatId));
        }
        document.append(DOCUMENT_END);
        return document.toString();
    }

    private String titleBlock(String title) {
        String generatedAt = LocalDateTime.now(clock).format(GENERATED_AT_FORMAT);
        return "\n\\begin{center}\n\\Large\\textbf{" + LatexEscaper.escape(title) + "}\n\n"
            + "\\normalsize Generated on " + generatedAt + "\n\\end{center}\n\\bigskip\n";
    }

    private String messageBlock(ChatMessage message, String chatId) {
        MessageRole role = message.messageRole();
        String label = message.role().isBlank() ? role.token() : message.role().strip();
        return "\n\\noindent{\\textbf{\\color{" + role.colorName() + "}"
            + LatexEscaper.escape(label.toUpperCase(Locale.ROOT)) + ":}}\n\n"
            + fragmentRenderer.render(message.content(), chatId)
            + "\n\n\\bigskip\n";
    }
}
