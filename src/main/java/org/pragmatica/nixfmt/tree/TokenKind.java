package org.pragmatica.nixfmt.tree;

import java.util.Optional;

/**
 * Lexical symbols of the Nix subset.
 */
public enum TokenKind implements SyntaxKind {
    // Trivia
    WHITESPACE,
    COMMENT,
    // Literals
    IDENT,
    INTEGER,
    FLOAT,
    PATH,
    URI,
    STRING,
    // Keywords
    LET,
    IN,
    REC,
    WITH,
    IF,
    THEN,
    ELSE,
    ASSERT,
    INHERIT,
    // Punctuation
    L_BRACE,
    R_BRACE,
    L_BRACK,
    R_BRACK,
    L_PAREN,
    R_PAREN,
    ASSIGN,
    SEMICOLON,
    COLON,
    COMMA,
    DOT,
    ELLIPSIS,
    QUESTION,
    AT,
    // Operators
    CONCAT,
    ADD,
    SUB,
    MUL,
    DIV,
    AND,
    OR,
    IMPLICATION,
    UPDATE,
    EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_OR_EQ,
    MORE,
    MORE_OR_EQ,
    INVERT,
    // Input the lexer could not classify
    ERROR;

    @Override
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public boolean isOpeningBracket() {
        return this == L_BRACE || this == L_BRACK || this == L_PAREN;
    }

    public boolean isClosingBracket() {
        return this == R_BRACE || this == R_BRACK || this == R_PAREN;
    }

    /**
     * Keyword spelled by the given identifier text, if any.
     */
    public static Optional<TokenKind> keyword(String text) {
        return Optional.ofNullable(switch (text) {
            case "let" -> LET;
            case "in" -> IN;
            case "rec" -> REC;
            case "with" -> WITH;
            case "if" -> IF;
            case "then" -> THEN;
            case "else" -> ELSE;
            case "assert" -> ASSERT;
            case "inherit" -> INHERIT;
            default -> null;
        });
    }
}
