package org.pragmatica.nixfmt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.nixfmt.tree.SourceLocation;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.nixfmt.tree.TokenKind.*;

class NixLexerTest {

    private static List<TokenKind> significantKinds(String input) {
        return NixLexer.tokenize(input)
                       .stream()
                       .map(SyntaxToken::kind)
                       .filter(kind -> kind != WHITESPACE)
                       .toList();
    }

    @Test
    void tokenize_isLossless() {
        var input = "let\n  a = ./foo/bar.nix; # note\n  b = \"x ${a} y\";\n/* c */ in a // { inherit b; }\n";

        var text = NixLexer.tokenize(input)
                           .stream()
                           .map(SyntaxToken::text)
                           .collect(Collectors.joining());

        assertEquals(input, text);
    }

    @Test
    void tokenize_emptyInput_hasNoTokens() {
        assertTrue(NixLexer.tokenize("")
                           .isEmpty());
    }

    // === Literals ===

    @Test
    void tokenize_numbers() {
        assertEquals(List.of(INTEGER, FLOAT, FLOAT, FLOAT), significantKinds("42 1.5 1e3 2.5E-2"));
    }

    @Test
    void tokenize_paths() {
        assertEquals(List.of(PATH, PATH, PATH, PATH, PATH, PATH),
                     significantKinds("./a ../b/c.nix /etc/nix ~/x <nixpkgs> a/b"));
    }

    @Test
    void tokenize_uris() {
        assertEquals(List.of(URI, URI), significantKinds("https://nixos.org/x?y=1 x:x"));
    }

    @Test
    void tokenize_colonFollowedBySpace_isNotUri() {
        assertEquals(List.of(IDENT, COLON, IDENT), significantKinds("x: x"));
    }

    @Test
    void tokenize_strings_areOpaque() {
        assertEquals(List.of(STRING), significantKinds("\"a ${ { b = \"}\"; }.b } \\\" c\""));
        assertEquals(List.of(STRING), significantKinds("''\n  line ''${x} ${y}\n''"));
    }

    @Test
    void tokenize_identifiersAndKeywords() {
        assertEquals(List.of(REC, INHERIT, IDENT, IDENT, IDENT, LET, IN),
                     significantKinds("rec inherit or foo-bar' _x let in"));
    }

    // === Operators ===

    @Test
    void tokenize_operators() {
        assertEquals(List.of(IDENT, UPDATE, IDENT, CONCAT, IDENT, EQUAL, IDENT, NOT_EQUAL, IDENT),
                     significantKinds("a//b ++ c==d!=e"));
        assertEquals(List.of(AND, OR, IMPLICATION, LESS_OR_EQ, MORE_OR_EQ, LESS, MORE, INVERT, ELLIPSIS),
                     significantKinds("&& || -> <= >= < > ! ..."));
    }

    // === Trivia ===

    @Test
    void tokenize_comments() {
        var tokens = NixLexer.tokenize("# line\n/* block\n */x");

        assertEquals(List.of(COMMENT, WHITESPACE, COMMENT, IDENT),
                     tokens.stream()
                           .map(SyntaxToken::kind)
                           .toList());
        assertEquals("# line", tokens.get(0)
                                     .text());
        assertTrue(tokens.get(0)
                         .isLineComment());
        assertFalse(tokens.get(2)
                          .isLineComment());
    }

    @Test
    void tokenize_tracksLinesAndColumns() {
        var tokens = NixLexer.tokenize("a\n  bc");
        var bc = tokens.get(2);

        assertEquals(SourceLocation.at(2, 3, 4), bc.span()
                                                   .start());
        assertEquals(SourceLocation.at(2, 5, 6), bc.span()
                                                   .end());
    }

    // === Errors ===

    @Test
    void tokenize_unclassifiedInput_becomesErrorToken() {
        assertEquals(List.of(IDENT, ERROR, IDENT), significantKinds("a & b"));
        assertEquals(List.of(ERROR), significantKinds("$"));
    }

    @Test
    void tokenize_unterminatedLiterals_becomeErrorTokens() {
        assertEquals(List.of(ERROR), significantKinds("\"open"));
        assertEquals(List.of(ERROR), significantKinds("/* open"));
    }
}
