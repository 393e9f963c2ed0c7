package org.pragmatica.nixfmt.tree;

import java.util.Optional;

/**
 * Leaf of the syntax tree: a lexical token or a piece of trivia.
 */
public final class SyntaxToken implements SyntaxElement {
    private final TokenKind kind;
    private final String text;
    private final SourceSpan span;
    private SyntaxNode parent;
    private int indexInParent = -1;

    private SyntaxToken(TokenKind kind, String text, SourceSpan span) {
        this.kind = kind;
        this.text = text;
        this.span = span;
    }

    public static SyntaxToken token(TokenKind kind, String text, SourceSpan span) {
        return new SyntaxToken(kind, text, span);
    }

    void attach(SyntaxNode parent, int index) {
        if (this.parent != null) {
            throw new IllegalStateException("Token " + this + " is already attached");
        }
        this.parent = parent;
        this.indexInParent = index;
    }

    @Override
    public TokenKind kind() {
        return kind;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public int indexInParent() {
        return indexInParent;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public SyntaxToken firstToken() {
        return this;
    }

    public boolean containsLineBreak() {
        return text.indexOf('\n') >= 0;
    }

    /**
     * Line comments run to the end of the line, so a line break must always follow them.
     */
    public boolean isLineComment() {
        return kind == TokenKind.COMMENT && text.startsWith("#");
    }

    @Override
    public String toString() {
        return kind + "@" + span + " '" + text + "'";
    }
}
