package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.support.AsciiTextNormalizer;

import java.util.Map;
import java.util.Optional;

/**
 * Maps fence language tags to the language names the {@code listings} package ships with.
 */
final class ListingLanguages {

    private static final Map<String, String> LISTINGS_NAMES = Map.ofEntries(
        Map.entry("python", "Python"),
        Map.entry("py", "Python"),
        Map.entry("java", "Java"),
        // listings has no JavaScript driver; Java keywords are the closest match
        Map.entry("javascript", "Java"),
        Map.entry("js", "Java"),
        Map.entry("typescript", "Java"),
        Map.entry("ts", "Java"),
        Map.entry("kotlin", "Java"),
        Map.entry("c", "C"),
        Map.entry("h", "C"),
        Map.entry("cpp", "C++"),
        Map.entry("c++", "C++"),
        Map.entry("cc", "C++"),
        Map.entry("hpp", "C++"),
        Map.entry("csharp", "[Sharp]C"),
        Map.entry("cs", "[Sharp]C"),
        Map.entry("bash", "bash"),
        Map.entry("sh", "sh"),
        Map.entry("shell", "bash"),
        Map.entry("zsh", "bash"),
        Map.entry("console", "bash"),
        Map.entry("sql", "SQL"),
        Map.entry("html", "HTML"),
        Map.entry("xml", "XML"),
        Map.entry("xsl", "XSLT"),
        Map.entry("xslt", "XSLT"),
        Map.entry("ruby", "Ruby"),
        Map.entry("rb", "Ruby"),
        Map.entry("php", "PHP"),
        Map.entry("perl", "Perl"),
        Map.entry("r", "R"),
        Map.entry("matlab", "Matlab"),
        Map.entry("octave", "Octave"),
        Map.entry("haskell", "Haskell"),
        Map.entry("hs", "Haskell"),
        Map.entry("fortran", "Fortran"),
        Map.entry("pascal", "Pascal"),
        Map.entry("delphi", "Delphi"),
        Map.entry("lisp", "Lisp"),
        Map.entry("elisp", "Lisp"),
        Map.entry("ocaml", "Caml"),
        Map.entry("erlang", "erlang"),
        Map.entry("tcl", "tcl"),
        Map.entry("tex", "TeX"),
        Map.entry("latex", "[LaTeX]TeX"),
        Map.entry("make", "make"),
        Map.entry("makefile", "make"),
        Map.entry("verilog", "Verilog"),
        Map.entry("vhdl", "VHDL"),
        Map.entry("gnuplot", "Gnuplot"),
        Map.entry("awk", "Awk")
    );

    private ListingLanguages() {
    }

    /**
     * Looks up the {@code listings} language for a fence tag.
     *
     * @param fenceLanguage tag after the opening fence, may be empty
     * @return listings language name, empty when the tag is blank or unknown
     */
    static Optional<String> forFenceTag(String fenceLanguage) {
        if (fenceLanguage == null || fenceLanguage.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LISTINGS_NAMES.get(AsciiTextNormalizer.toLowerAscii(fenceLanguage.trim())));
    }
}
