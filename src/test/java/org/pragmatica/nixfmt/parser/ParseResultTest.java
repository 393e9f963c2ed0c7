package org.pragmatica.nixfmt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.nixfmt.error.FormatException;
import org.pragmatica.nixfmt.error.ParseError;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SourceLocation;
import org.pragmatica.nixfmt.tree.SourceSpan;
import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    private static final SourceLocation LOC = SourceLocation.at(1, 1, 0);
    private static final SourceLocation END_LOC = SourceLocation.at(1, 3, 2);

    // === Success Tests ===

    @Test
    void success_isSuccess_returnsTrue() {
        var result = new ParseResult.Success(createRoot("42"));

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
    }

    @Test
    void success_unwrap_returnsRoot() {
        var root = createRoot("42");

        assertSame(root, new ParseResult.Success(root).unwrap());
    }

    // === Failure Tests ===

    @Test
    void failure_isFailure_returnsTrue() {
        var result = new ParseResult.Failure(new ParseError.UnexpectedEof(END_LOC, "expression"));

        assertTrue(result.isFailure());
        assertFalse(result.isSuccess());
    }

    @Test
    void failure_unwrap_carriesError() {
        var error = new ParseError.UnexpectedInput(LOC, "}", "expression");
        var result = new ParseResult.Failure(error);

        var thrown = assertThrows(FormatException.class, result::unwrap);

        assertSame(error, thrown.error());
        assertEquals("Unexpected '}' at 1:1, expected expression", thrown.getMessage());
    }

    private static SyntaxNode createRoot(String text) {
        var token = SyntaxToken.token(TokenKind.INTEGER, text, SourceSpan.of(LOC, END_LOC));
        var value = SyntaxNode.node(NodeKind.VALUE, List.of(token));
        return SyntaxNode.node(NodeKind.ROOT, List.of(value));
    }
}
