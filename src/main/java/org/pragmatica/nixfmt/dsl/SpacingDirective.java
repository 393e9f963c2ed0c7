package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxElement;
import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxQueries;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * One spacing rule: put {@code action} on the {@code side} of every {@code anchor}
 * token that lies inside a node of one of the {@code containerFilter} kinds and
 * satisfies {@code guard}.
 */
public record SpacingDirective(
 Optional<ImmutableSet<NodeKind>> containerFilter,
 TokenKind anchor,
 Side side,
 Optional<Predicate<SyntaxElement>> guard,
 WhitespaceAction action) {

    public boolean isGuarded() {
        return guard.isPresent();
    }

    /**
     * Matches the directive against a gap, ignoring the guard.
     */
    public Optional<SpacingMatch> match(Gap gap) {
        var token = gap.anchor(side);
        if (token.kind() != anchor) {
            return Optional.empty();
        }
        return container(token).map(container -> new SpacingMatch(this, gap, token, container));
    }

    /**
     * Evaluates the guard on a token this directive is anchored on; unguarded directives always hold.
     */
    public boolean guardHolds(SyntaxToken token) {
        return guard.map(predicate -> predicate.test(token))
                    .orElse(true);
    }

    private Optional<SyntaxNode> container(SyntaxToken token) {
        return containerFilter.map(kinds -> SyntaxQueries.enclosing(token, kinds))
                              .orElseGet(token::parent);
    }

    @Override
    public String toString() {
        var filter = containerFilter.map(kinds -> "inside " + kinds + " ")
                                    .orElse("");
        var when = isGuarded()
                   ? " when <guard>"
                   : "";
        return filter + side.name()
                            .toLowerCase() + " " + anchor + when + ": " + action;
    }
}
