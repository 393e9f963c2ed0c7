package org.pragmatica.nixfmt.error;

import org.pragmatica.nixfmt.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * String or comment that is never closed.
     */
    record UnterminatedLiteral(
    SourceLocation location,
    String literal) implements ParseError {
        @Override
        public String message() {
            return "Unterminated " + literal + " starting at " + location;
        }
    }
}
