package org.pragmatica.nixfmt.parser;

import org.pragmatica.nixfmt.tree.SourceLocation;
import org.pragmatica.nixfmt.tree.SourceSpan;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the Nix subset. Whitespace and comments are emitted as tokens,
 * so the concatenated token text always equals the input. Input that cannot
 * be classified becomes an {@link TokenKind#ERROR} token.
 */
public final class NixLexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private NixLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<SyntaxToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new NixLexer(input).tokenizeAll();
    }

    private List<SyntaxToken> tokenizeAll() {
        var tokens = new ArrayList<SyntaxToken>();
        while (!isAtEnd()) {
            tokens.add(nextToken());
        }
        return tokens;
    }

    private SyntaxToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isWhitespace(c)) {
            while (!isAtEnd() && isWhitespace(peek())) {
                advance();
            }
            return token(TokenKind.WHITESPACE, start);
        }
        if (c == '#') {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            return token(TokenKind.COMMENT, start);
        }
        if (c == '/' && peekAt(1) == '*') {
            return scanBlockComment(start);
        }
        int pathLength = pathLength();
        if (pathLength > 0) {
            advance(pathLength);
            return token(TokenKind.PATH, start);
        }
        if (c == '<') {
            int searchPathLength = searchPathLength();
            if (searchPathLength > 0) {
                advance(searchPathLength);
                return token(TokenKind.PATH, start);
            }
        }
        if (isIdentifierStart(c)) {
            int uriLength = uriLength();
            if (uriLength > 0) {
                advance(uriLength);
                return token(TokenKind.URI, start);
            }
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        if (c == '\'' && peekAt(1) == '\'') {
            return scanIndentedString(start);
        }
        return scanOperator(start);
    }

    private SyntaxToken scanBlockComment(SourceLocation start) {
        advance(2);
        // skip /*
        while (!isAtEnd()) {
            if (peek() == '*' && peekAt(1) == '/') {
                advance(2);
                return token(TokenKind.COMMENT, start);
            }
            advance();
        }
        return token(TokenKind.ERROR, start);
    }

    private SyntaxToken scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var text = input.substring(start.offset(), pos);
        return token(TokenKind.keyword(text)
                              .orElse(TokenKind.IDENT),
                     start);
    }

    private SyntaxToken scanNumber(SourceLocation start) {
        var kind = TokenKind.INTEGER;
        skipDigits();
        if (!isAtEnd() && peek() == '.' && isDigit(peekAt(1))) {
            kind = TokenKind.FLOAT;
            advance();
            skipDigits();
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int exponent = (peekAt(1) == '-' || peekAt(1) == '+') ? 2 : 1;
            if (isDigit(peekAt(exponent))) {
                kind = TokenKind.FLOAT;
                advance(exponent);
                skipDigits();
            }
        }
        return token(kind, start);
    }

    private SyntaxToken scanString(SourceLocation start) {
        return skipString()
               ? token(TokenKind.STRING, start)
               : token(TokenKind.ERROR, start);
    }

    private SyntaxToken scanIndentedString(SourceLocation start) {
        return skipIndentedString()
               ? token(TokenKind.STRING, start)
               : token(TokenKind.ERROR, start);
    }

    /**
     * Skips a double-quoted string, returns false if it is not terminated.
     */
    private boolean skipString() {
        advance();
        // skip opening quote
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\') {
                advance(Math.min(2, input.length() - pos));
            }else if (c == '$' && peekAt(1) == '{') {
                if (!skipInterpolation()) {
                    return false;
                }
            }else if (c == '"') {
                advance();
                return true;
            }else {
                advance();
            }
        }
        return false;
    }

    /**
     * Skips an indented {@code ''...''} string, returns false if it is not terminated.
     */
    private boolean skipIndentedString() {
        advance(2);
        // skip opening ''
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'' && peekAt(1) == '\'') {
                char next = peekAt(2);
                if (next == '\'' || next == '$') {
                    advance(3);
                }else if (next == '\\') {
                    advance(Math.min(4, input.length() - pos));
                }else {
                    advance(2);
                    return true;
                }
            }else if (c == '$' && peekAt(1) == '{') {
                if (!skipInterpolation()) {
                    return false;
                }
            }else {
                advance();
            }
        }
        return false;
    }

    private boolean skipInterpolation() {
        advance(2);
        // skip ${
        int braceDepth = 1;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '{') {
                braceDepth++ ;
                advance();
            }else if (c == '}') {
                braceDepth-- ;
                advance();
                if (braceDepth == 0) {
                    return true;
                }
            }else if (c == '"') {
                if (!skipString()) {
                    return false;
                }
            }else if (c == '\'' && peekAt(1) == '\'') {
                if (!skipIndentedString()) {
                    return false;
                }
            }else {
                advance();
            }
        }
        return false;
    }

    private SyntaxToken scanOperator(SourceLocation start) {
        char c = advance();
        var kind = switch (c) {
            case'{' -> TokenKind.L_BRACE;
            case'}' -> TokenKind.R_BRACE;
            case'[' -> TokenKind.L_BRACK;
            case']' -> TokenKind.R_BRACK;
            case'(' -> TokenKind.L_PAREN;
            case')' -> TokenKind.R_PAREN;
            case';' -> TokenKind.SEMICOLON;
            case':' -> TokenKind.COLON;
            case',' -> TokenKind.COMMA;
            case'?' -> TokenKind.QUESTION;
            case'@' -> TokenKind.AT;
            case'*' -> TokenKind.MUL;
            case'.' -> match("..") ? TokenKind.ELLIPSIS : TokenKind.DOT;
            case'=' -> match("=") ? TokenKind.EQUAL : TokenKind.ASSIGN;
            case'!' -> match("=") ? TokenKind.NOT_EQUAL : TokenKind.INVERT;
            case'<' -> match("=") ? TokenKind.LESS_OR_EQ : TokenKind.LESS;
            case'>' -> match("=") ? TokenKind.MORE_OR_EQ : TokenKind.MORE;
            case'+' -> match("+") ? TokenKind.CONCAT : TokenKind.ADD;
            case'-' -> match(">") ? TokenKind.IMPLICATION : TokenKind.SUB;
            case'/' -> match("/") ? TokenKind.UPDATE : TokenKind.DIV;
            case'&' -> match("&") ? TokenKind.AND : TokenKind.ERROR;
            case'|' -> match("|") ? TokenKind.OR : TokenKind.ERROR;
            default -> TokenKind.ERROR;
        };
        return token(kind, start);
    }

    private boolean match(String expected) {
        if (input.startsWith(expected, pos)) {
            advance(expected.length());
            return true;
        }
        return false;
    }

    /**
     * Length of a path literal such as {@code ./foo/bar.nix} or {@code ~/x} at the current position, 0 if none.
     */
    private int pathLength() {
        int i = pos;
        if (charAt(i) == '~' && charAt(i + 1) == '/') {
            i++ ;
        }else {
            while (isPathChar(charAt(i))) {
                i++ ;
            }
        }
        int segments = 0;
        while (charAt(i) == '/' && isPathChar(charAt(i + 1))) {
            i++ ;
            while (isPathChar(charAt(i))) {
                i++ ;
            }
            segments++ ;
        }
        return segments == 0
               ? 0
               : i - pos;
    }

    /**
     * Length of a search path such as {@code <nixpkgs>} at the current position, 0 if none.
     */
    private int searchPathLength() {
        int i = pos + 1;
        if (!isPathChar(charAt(i))) {
            return 0;
        }
        while (isPathChar(charAt(i)) || (charAt(i) == '/' && isPathChar(charAt(i + 1)))) {
            i++ ;
        }
        return charAt(i) == '>'
               ? i + 1 - pos
               : 0;
    }

    /**
     * Length of a URI such as {@code https://nixos.org} at the current position, 0 if none.
     */
    private int uriLength() {
        int i = pos + 1;
        while (isSchemeChar(charAt(i))) {
            i++ ;
        }
        if (charAt(i) != ':' || !isUriChar(charAt(i + 1))) {
            return 0;
        }
        i++ ;
        while (isUriChar(charAt(i))) {
            i++ ;
        }
        return i - pos;
    }

    private void skipDigits() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        return charAt(pos + offset);
    }

    private char charAt(int index) {
        return index < input.length()
               ? input.charAt(index)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++ ) {
            advance();
        }
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SyntaxToken token(TokenKind kind, SourceLocation start) {
        return SyntaxToken.token(kind,
                                 input.substring(start.offset(), pos),
                                 SourceSpan.of(start, currentLocation()));
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '\'' || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isPathChar(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '.' || c == '-' || c == '+';
    }

    private static boolean isSchemeChar(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '+' || c == '-' || c == '.';
    }

    private static boolean isUriChar(char c) {
        return isIdentifierStart(c) || isDigit(c) || "%/?:@&=+$,-_.!~*'".indexOf(c) >= 0;
    }
}
