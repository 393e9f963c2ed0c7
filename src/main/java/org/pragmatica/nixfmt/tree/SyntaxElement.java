package org.pragmatica.nixfmt.tree;

import java.util.Optional;

/**
 * Element of the lossless syntax tree - an interior node or a leaf token.
 * Whitespace and comments are ordinary leaf tokens, so concatenating the text
 * of all leaves reproduces the source exactly.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {
    SyntaxKind kind();

    /**
     * The node owning this element, empty for the root.
     */
    Optional<SyntaxNode> parent();

    /**
     * Position of this element among its parent's children, {@code -1} for the root.
     */
    int indexInParent();

    /**
     * The source span covered by this element.
     */
    SourceSpan span();

    /**
     * The original source text of this element.
     */
    String text();

    /**
     * The first leaf token of this element (the token itself for leaves).
     */
    SyntaxToken firstToken();

    default boolean isTrivia() {
        return kind().isTrivia();
    }
}
