package org.pragmatica.nixfmt.dsl;

import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxToken;

/**
 * A directive matched against a concrete gap.
 *
 * @param directive the matching directive
 * @param gap       the gap it was matched against
 * @param anchor    the token it is anchored on
 * @param container the node satisfying the container filter (the anchor's parent without a filter)
 */
public record SpacingMatch(SpacingDirective directive, Gap gap, SyntaxToken anchor, SyntaxNode container) {

    public WhitespaceAction action() {
        return directive.action();
    }

    public boolean isGuarded() {
        return directive.isGuarded();
    }

    public boolean guardHolds() {
        return directive.guardHolds(anchor);
    }

    /**
     * Whether the gap gets a line break. Only {@code _OR_NEWLINE} actions break, and only
     * where the source already broke the line: in the gap itself, or, for the gap just
     * inside the container's own brackets, anywhere within the container.
     */
    public boolean breaksLine() {
        return directive.action()
                        .breaksLine(gap.hasLineBreak() || (delimitsContainer() && container.isMultiline()));
    }

    private boolean delimitsContainer() {
        var ownedByContainer = anchor.parent()
                                     .filter(parent -> parent == container)
                                     .isPresent();
        return ownedByContainer && (directive.side() == Side.AFTER
                                    ? anchor.kind()
                                            .isOpeningBracket()
                                    : anchor.kind()
                                            .isClosingBracket());
    }
}
