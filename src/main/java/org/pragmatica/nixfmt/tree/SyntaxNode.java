package org.pragmatica.nixfmt.tree;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Interior node of the syntax tree. Children are fixed at construction and
 * receive their parent link from it, so a tree is assembled bottom-up and is
 * read-only afterwards.
 */
public final class SyntaxNode implements SyntaxElement {
    private final NodeKind kind;
    private final ImmutableList<SyntaxElement> children;
    private final boolean multiline;
    private SyntaxNode parent;
    private int indexInParent = -1;

    private SyntaxNode(NodeKind kind, List<SyntaxElement> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Node " + kind + " must have at least one child");
        }
        this.kind = kind;
        this.children = ImmutableList.copyOf(children);
        this.multiline = span().isMultiline();
        for (int i = 0; i < this.children.size(); i++ ) {
            var child = this.children.get(i);
            if (child instanceof SyntaxNode node) {
                node.attach(this, i);
            }else if (child instanceof SyntaxToken token) {
                token.attach(this, i);
            }
        }
    }

    public static SyntaxNode node(NodeKind kind, List<SyntaxElement> children) {
        return new SyntaxNode(kind, children);
    }

    private void attach(SyntaxNode parent, int index) {
        if (this.parent != null) {
            throw new IllegalStateException("Node " + kind + " is already attached");
        }
        this.parent = parent;
        this.indexInParent = index;
    }

    @Override
    public NodeKind kind() {
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

    public List<SyntaxElement> children() {
        return children;
    }

    @Override
    public SourceSpan span() {
        return firstToken().span()
                           .merge(lastToken().span());
    }

    @Override
    public String text() {
        var sb = new StringBuilder();
        tokens().forEach(token -> sb.append(token.text()));
        return sb.toString();
    }

    @Override
    public SyntaxToken firstToken() {
        return children.get(0)
                       .firstToken();
    }

    public SyntaxToken lastToken() {
        var last = children.get(children.size() - 1);
        return last instanceof SyntaxNode node
               ? node.lastToken()
               : (SyntaxToken) last;
    }

    /**
     * All leaf tokens of this subtree in source order, trivia included.
     */
    public List<SyntaxToken> tokens() {
        var result = new ArrayList<SyntaxToken>();
        collectTokens(this, result);
        return result;
    }

    /**
     * Whether the original text of this node spans more than one line.
     */
    public boolean isMultiline() {
        return multiline;
    }

    private static void collectTokens(SyntaxNode node, List<SyntaxToken> result) {
        for (var child : node.children) {
            if (child instanceof SyntaxNode inner) {
                collectTokens(inner, result);
            }else if (child instanceof SyntaxToken token) {
                result.add(token);
            }
        }
    }

    @Override
    public String toString() {
        return kind + "@" + span();
    }
}
