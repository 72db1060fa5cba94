package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;
import com.williamcallahan.chatlatex.support.AsciiTextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifts protectable constructs out of a plain-text chunk and replaces them with placeholders.
 *
 * <p>Passes run in a fixed order: placeholder-shaped literals, whitelisted LaTeX commands,
 * display math, inline math, inline code, images, headers. Each pass sees the output of the
 * previous one, so text already turned into a placeholder is never scanned again. Math and code
 * regions resolve nested placeholders back to their source, which keeps their content exactly
 * as written.</p>
 */
final class RegionProtector {

    private static final Pattern BRACKET_DISPLAY_MATH = Pattern.compile("\\\\\\[(.+?)\\\\\\]", Pattern.DOTALL);
    private static final Pattern DOLLAR_DISPLAY_MATH = Pattern.compile("\\$\\$([^$]+)\\$\\$");
    private static final Pattern PAREN_INLINE_MATH = Pattern.compile("\\\\\\((.+?)\\\\\\)");
    private static final Pattern DOLLAR_INLINE_MATH = Pattern.compile("(?<!\\$)\\$([^$]+?)\\$(?!\\$)");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern IMAGE_TAG = Pattern.compile("<img\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_LINE = Pattern.compile("(?m)^(#{1,4})[ \\t]+(.+)$");
    private static final Pattern CLOSING_HASHES = Pattern.compile("[ \\t]+#+[ \\t]*$");

    private static final String BOLD_MARKER = "**";
    private static final String INLINE_CODE_DELIMITERS = "|!/:;@+=";
    private static final String ESCAPED_CHARACTERS = "$%&#_{}";
    private static final String IMAGE_UNAVAILABLE = "\\textit{[Image unavailable]}";

    /** Whitelisted text commands and the number of brace groups each one takes. */
    private static final Map<String, Integer> TEXT_COMMANDS = Map.ofEntries(
        Map.entry("textbf", 1),
        Map.entry("textit", 1),
        Map.entry("emph", 1),
        Map.entry("underline", 1),
        Map.entry("texttt", 1),
        Map.entry("textsc", 1),
        Map.entry("textsf", 1),
        Map.entry("textrm", 1),
        Map.entry("textsl", 1),
        Map.entry("textup", 1),
        Map.entry("textmd", 1),
        Map.entry("textnormal", 1),
        Map.entry("textsuperscript", 1),
        Map.entry("textsubscript", 1),
        Map.entry("textcolor", 2),
        Map.entry("colorbox", 2),
        Map.entry("href", 2),
        Map.entry("url", 1),
        Map.entry("footnote", 1),
        Map.entry("mbox", 1)
    );

    private static final String[] SECTIONING_COMMANDS = {"section*", "subsection*", "subsubsection*", "paragraph*"};

    private final ImageSourceResolver imageSourceResolver;

    RegionProtector(ImageSourceResolver imageSourceResolver) {
        this.imageSourceResolver = Objects.requireNonNull(imageSourceResolver, "Image source resolver cannot be null");
    }

    /**
     * Runs every protection pass over a plain-text chunk.
     *
     * @param text plain text, CRLF already folded to LF
     * @param store placeholder store of the current call
     * @param chatId chat the text belongs to, used to resolve images
     * @param allowHeaders false inside table cells, where sectioning commands and row breaks are not allowed
     * @return carrier text with placeholders
     */
    String protect(String text, ProtectedRegionStore store, String chatId, boolean allowHeaders) {
        store.reserveIdsUsedIn(text);
        String protectedText = protectPlaceholderLiterals(text, store);
        protectedText = protectLatexCommands(protectedText, store, allowHeaders);
        protectedText = protectDisplayMath(protectedText, store);
        protectedText = protectInlineMath(protectedText, store);
        protectedText = protectInlineCode(protectedText, store);
        protectedText = protectImages(protectedText, store, chatId);
        if (allowHeaders) {
            protectedText = protectHeaders(protectedText, store);
        }
        return protectedText;
    }

    private String protectPlaceholderLiterals(String text, ProtectedRegionStore store) {
        return replaceEach(ProtectedRegionStore.PLACEHOLDER_PATTERN, text,
            matcher -> store.protect(RegionKind.LITERAL, matcher.group(), LatexEscaper.escape(matcher.group())));
    }

    private String protectLatexCommands(String text, ProtectedRegionStore store, boolean allowLineBreaks) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder result = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            char current = text.charAt(cursor);
            if (current != '\\' || cursor + 1 >= text.length()) {
                result.append(current);
                cursor++;
                continue;
            }
            int commandEnd = verbatimCommandEnd(text, cursor, allowLineBreaks);
            if (commandEnd < 0) {
                result.append(current);
                cursor++;
                continue;
            }
            String command = text.substring(cursor, commandEnd);
            result.append(store.protect(RegionKind.LATEXCMD, store.expandSource(command), store.expandLatex(command)));
            cursor = commandEnd;
        }
        return result.toString();
    }

    /**
     * Finds the end of a verbatim command starting at a backslash.
     *
     * <p>A {@code \\} ends a {@code tabular} row, so it only counts when line breaks are allowed.</p>
     *
     * @return index after the command, or -1 when the backslash does not start one
     */
    private static int verbatimCommandEnd(String text, int backslashIndex, boolean allowLineBreaks) {
        char next = text.charAt(backslashIndex + 1);
        if (next == '\\') {
            return allowLineBreaks ? backslashIndex + 2 : -1;
        }
        if (ESCAPED_CHARACTERS.indexOf(next) >= 0) {
            return backslashIndex + 2;
        }
        int nameEnd = backslashIndex + 1;
        while (nameEnd < text.length() && AsciiTextNormalizer.isAsciiLetter(text.charAt(nameEnd))) {
            nameEnd++;
        }
        Integer groupCount = TEXT_COMMANDS.get(text.substring(backslashIndex + 1, nameEnd));
        if (groupCount == null) {
            return -1;
        }
        int cursor = nameEnd;
        for (int groupIndex = 0; groupIndex < groupCount; groupIndex++) {
            cursor = balancedGroupEnd(text, cursor);
            if (cursor < 0) {
                return -1;
            }
        }
        if (!allowLineBreaks && text.substring(backslashIndex, cursor).contains("\\\\")) {
            return -1;
        }
        return cursor;
    }

    private static int balancedGroupEnd(String text, int openIndex) {
        if (openIndex >= text.length() || text.charAt(openIndex) != '{') {
            return -1;
        }
        int depth = 0;
        for (int index = openIndex; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current == '\\') {
                index++;
            } else if (current == '{') {
                depth++;
            } else if (current == '}') {
                depth--;
                if (depth == 0) {
                    return index + 1;
                }
            } else if (current == '\n' && index + 1 < text.length() && text.charAt(index + 1) == '\n') {
                // a paragraph break ends any argument
                return -1;
            }
        }
        return -1;
    }

    private String protectDisplayMath(String text, ProtectedRegionStore store) {
        String protectedText = replaceEach(BRACKET_DISPLAY_MATH, text, matcher -> displayMath(matcher, store));
        return replaceEach(DOLLAR_DISPLAY_MATH, protectedText, matcher -> displayMath(matcher, store));
    }

    private static String displayMath(Matcher matcher, ProtectedRegionStore store) {
        String content = store.expandSource(matcher.group(1)).replace(BOLD_MARKER, "");
        if (content.isBlank()) {
            return matcher.group();
        }
        return store.protect(RegionKind.DISPLAYMATH, store.expandSource(matcher.group()), "$$" + content + "$$");
    }

    private String protectInlineMath(String text, ProtectedRegionStore store) {
        String protectedText = replaceEach(PAREN_INLINE_MATH, text, matcher -> inlineMath(matcher, store));
        return replaceEach(DOLLAR_INLINE_MATH, protectedText, matcher -> inlineMath(matcher, store));
    }

    private static String inlineMath(Matcher matcher, ProtectedRegionStore store) {
        String content = store.expandSource(matcher.group(1));
        if (content.isBlank() || content.indexOf('\n') >= 0 || content.indexOf('`') >= 0) {
            return matcher.group();
        }
        return store.protect(RegionKind.INLINEMATH, store.expandSource(matcher.group()), "$" + content + "$");
    }

    private String protectInlineCode(String text, ProtectedRegionStore store) {
        return replaceEach(INLINE_CODE, text, matcher -> {
            String code = store.expandSource(matcher.group(1));
            if (code.indexOf('\n') >= 0) {
                return matcher.group();
            }
            return store.protect(RegionKind.INLINECODE, store.expandSource(matcher.group()), inlineCodeCommand(code));
        });
    }

    /**
     * Wraps code in {@code \lstinline} with a delimiter the code does not contain.
     */
    static String inlineCodeCommand(String code) {
        for (int index = 0; index < INLINE_CODE_DELIMITERS.length(); index++) {
            char delimiter = INLINE_CODE_DELIMITERS.charAt(index);
            if (code.indexOf(delimiter) < 0) {
                return "\\lstinline" + delimiter + code + delimiter;
            }
        }
        return typewriterCommand(code);
    }

    /**
     * Renders code as escaped {@code \texttt}, which also works inside moving arguments.
     */
    static String typewriterCommand(String code) {
        return "\\texttt{" + LatexEscaper.escape(code) + "}";
    }

    private String protectImages(String text, ProtectedRegionStore store, String chatId) {
        return replaceEach(IMAGE_TAG, text, matcher -> {
            String tag = store.expandSource(matcher.group());
            return store.protect(RegionKind.IMAGE, tag, imageCommand(tag, chatId));
        });
    }

    private String imageCommand(String tag, String chatId) {
        Element image = Jsoup.parseBodyFragment(tag).selectFirst("img");
        String source = image == null ? "" : image.attr("src").trim();
        if (source.isEmpty()) {
            return IMAGE_UNAVAILABLE;
        }
        Optional<Path> resolved = imageSourceResolver.resolve(source, chatId);
        return resolved
            .map(path -> "\\begin{center}\\includegraphics[width=\\linewidth]{"
                + path.toString().replace('\\', '/') + "}\\end{center}")
            .orElse(IMAGE_UNAVAILABLE);
    }

    private String protectHeaders(String text, ProtectedRegionStore store) {
        return replaceEach(HEADER_LINE, text, matcher -> {
            int level = matcher.group(1).length();
            String title = CLOSING_HASHES.matcher(matcher.group(2)).replaceFirst("").strip();
            String latex = "\\" + SECTIONING_COMMANDS[level - 1] + "{" + renderTitle(title, store) + "}";
            return store.protect(RegionKind.HEADER, store.expandSource(matcher.group()), latex);
        });
    }

    /**
     * Renders a header title. Math, code and commands in it were lifted by the earlier passes of
     * this scan; inline code is switched to {@code \texttt} because {@code \lstinline} breaks
     * inside a sectioning argument.
     */
    private static String renderTitle(String title, ProtectedRegionStore store) {
        StringBuilder titleText = new StringBuilder(title.length());
        for (ProtectedRegionStore.TextToken token : store.tokenize(title)) {
            ProtectedRegion region = token.region();
            if (region != null && region.kind() == RegionKind.INLINECODE) {
                String source = region.source();
                String code = source.substring(1, source.length() - 1);
                titleText.append(store.protect(RegionKind.INLINECODE, source, typewriterCommand(code)));
            } else {
                titleText.append(token.text());
            }
        }
        String formatted = InlineFormatter.format(LatexEscaper.escapeCarrier(titleText.toString(), store));
        return store.expandLatex(formatted);
    }

    private static String replaceEach(Pattern pattern, String text, Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder result = new StringBuilder(text.length());
        do {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacer.apply(matcher)));
        } while (matcher.find());
        matcher.appendTail(result);
        return result.toString();
    }
}
