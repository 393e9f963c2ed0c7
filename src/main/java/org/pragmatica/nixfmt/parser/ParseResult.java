package org.pragmatica.nixfmt.parser;

import org.pragmatica.nixfmt.error.FormatException;
import org.pragmatica.nixfmt.error.ParseError;
import org.pragmatica.nixfmt.tree.SyntaxNode;

/**
 * Result of parsing a source text - either success with the tree root or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The tree root, or a {@link FormatException} carrying the parse error.
     */
    SyntaxNode unwrap();

    /**
     * Successful parse, root is a {@link org.pragmatica.nixfmt.tree.NodeKind#ROOT} node.
     */
    record Success(SyntaxNode root) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public SyntaxNode unwrap() {
            return root;
        }
    }

    /**
     * Failed parse.
     */
    record Failure(ParseError error) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public SyntaxNode unwrap() {
            throw new FormatException(error);
        }
    }
}
