package org.pragmatica.nixfmt.tree;

import com.google.common.collect.Sets;

import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read-only structural queries over a built syntax tree. Formatting rules use
 * them as match conditions and guards.
 */
public final class SyntaxQueries {
    private SyntaxQueries() {}

    /**
     * True if any strict ancestor of the element has one of the given kinds.
     */
    public static boolean isInside(SyntaxElement element, Set<NodeKind> kinds) {
        return enclosing(element, kinds).isPresent();
    }

    /**
     * The nearest strict ancestor of the element with one of the given kinds.
     */
    public static Optional<SyntaxNode> enclosing(SyntaxElement element, Set<NodeKind> kinds) {
        var current = element.parent();
        while (current.isPresent()) {
            var node = current.get();
            if (kinds.contains(node.kind())) {
                return current;
            }
            current = node.parent();
        }
        return Optional.empty();
    }

    /**
     * Previous sibling of the element, whitespace skipped. Comments are returned.
     */
    public static Optional<SyntaxElement> previousSibling(SyntaxElement element) {
        return sibling(element, -1);
    }

    /**
     * Next sibling of the element, whitespace skipped. Comments are returned.
     */
    public static Optional<SyntaxElement> nextSibling(SyntaxElement element) {
        return sibling(element, 1);
    }

    public static Optional<SyntaxKind> previousSiblingKind(SyntaxElement element) {
        return previousSibling(element).map(SyntaxElement::kind);
    }

    public static Optional<SyntaxKind> nextSiblingKind(SyntaxElement element) {
        return nextSibling(element).map(SyntaxElement::kind);
    }

    /**
     * The value just before the element is a set or list literal, e.g. the
     * {@code ;} in {@code a = [ 1 ];}.
     */
    public static boolean afterLiteral(SyntaxElement element) {
        return previousSiblingKind(element).filter(kind -> kind == NodeKind.SET || kind == NodeKind.LIST)
                                           .isPresent();
    }

    /**
     * Guard matching elements whose parent has one of the given kinds.
     */
    public static Predicate<SyntaxElement> childOf(NodeKind first, NodeKind... rest) {
        var kinds = Sets.immutableEnumSet(first, rest);
        return element -> element.parent()
                                 .map(parent -> kinds.contains(parent.kind()))
                                 .orElse(false);
    }

    /**
     * The whitespace directly in front of the element contains a line break.
     */
    public static boolean lineBreakBefore(SyntaxElement element) {
        var current = element;
        while (current.indexInParent() == 0) {
            var parent = current.parent();
            if (parent.isEmpty()) {
                return false;
            }
            current = parent.get();
        }
        if (current.indexInParent() < 0) {
            return false;
        }
        var owner = current.parent()
                           .orElseThrow();
        var previous = owner.children()
                            .get(current.indexInParent() - 1);
        return previous instanceof SyntaxToken token
               && token.kind() == TokenKind.WHITESPACE
               && token.containsLineBreak();
    }

    /**
     * The outermost element that starts with the given token: the element a
     * line begins with when a line break precedes the token.
     */
    public static SyntaxElement lineStart(SyntaxToken token) {
        SyntaxElement current = token;
        var parent = current.parent();
        while (parent.isPresent() && parent.get().firstToken() == token && parent.get().kind() != NodeKind.ROOT) {
            current = parent.get();
            parent = current.parent();
        }
        return current;
    }

    private static Optional<SyntaxElement> sibling(SyntaxElement element, int step) {
        var parent = element.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        var siblings = parent.get()
                             .children();
        for (int i = element.indexInParent() + step; i >= 0 && i < siblings.size(); i += step) {
            var candidate = siblings.get(i);
            if (candidate.kind() != TokenKind.WHITESPACE) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
