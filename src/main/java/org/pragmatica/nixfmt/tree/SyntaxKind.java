package org.pragmatica.nixfmt.tree;

/**
 * Kind tag of a syntax element: either a grammar production ({@link NodeKind})
 * or a lexical symbol ({@link TokenKind}).
 */
public sealed interface SyntaxKind permits NodeKind, TokenKind {
    String name();

    default boolean isTrivia() {
        return false;
    }
}
