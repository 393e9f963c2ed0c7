package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxElement;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Fluent builder for {@link SpacingRules}. Directives are kept in the order
 * they are written, which is their precedence order.
 *
 * <p>Example usage:
 * <pre>{@code
 * var rules = new SpacingDsl()
 *     .inside(NodeKind.SET_ENTRY).around(TokenKind.ASSIGN).singleSpace()
 *     .inside(NodeKind.LIST).after(TokenKind.L_BRACK).singleSpaceOrNewline()
 *     .build();
 * }</pre>
 */
public final class SpacingDsl {
    private final List<SpacingDirective> directives = new ArrayList<>();

    /**
     * Start a directive that only applies inside a node of one of the given kinds.
     */
    public RuleBuilder inside(NodeKind first, NodeKind... rest) {
        return new RuleBuilder(this, Optional.of(Sets.immutableEnumSet(first, rest)));
    }

    public RuleBuilder inside(Set<NodeKind> kinds) {
        checkArgument(!kinds.isEmpty(), "Container filter must name at least one node kind");
        return new RuleBuilder(this, Optional.of(Sets.immutableEnumSet(kinds)));
    }

    /**
     * Start a directive for the gap before the anchor, wherever the anchor appears.
     */
    public RuleBuilder before(TokenKind anchor) {
        return new RuleBuilder(this, Optional.empty()).before(anchor);
    }

    public RuleBuilder after(TokenKind anchor) {
        return new RuleBuilder(this, Optional.empty()).after(anchor);
    }

    public RuleBuilder around(TokenKind anchor) {
        return new RuleBuilder(this, Optional.empty()).around(anchor);
    }

    public SpacingRules build() {
        return new SpacingRules(directives);
    }

    private SpacingDsl register(SpacingDirective directive) {
        directives.add(directive);
        return this;
    }

    /**
     * A directive under construction; finished by one of the action methods.
     */
    public static final class RuleBuilder {
        private final SpacingDsl dsl;
        private final Optional<ImmutableSet<NodeKind>> containerFilter;
        private final Set<Side> sides = EnumSet.noneOf(Side.class);
        private TokenKind anchor;
        private Optional<Predicate<SyntaxElement>> guard = Optional.empty();

        private RuleBuilder(SpacingDsl dsl, Optional<ImmutableSet<NodeKind>> containerFilter) {
            this.dsl = dsl;
            this.containerFilter = containerFilter;
        }

        public RuleBuilder before(TokenKind anchor) {
            return anchor(anchor, Side.BEFORE);
        }

        public RuleBuilder after(TokenKind anchor) {
            return anchor(anchor, Side.AFTER);
        }

        /**
         * Both {@link #before} and {@link #after} with the same action.
         */
        public RuleBuilder around(TokenKind anchor) {
            anchor(anchor, Side.BEFORE);
            return anchor(anchor, Side.AFTER);
        }

        /**
         * Narrow the directive with a guard evaluated on the anchor token.
         */
        public RuleBuilder when(Predicate<SyntaxElement> predicate) {
            checkState(guard.isEmpty(), "Directive already has a guard");
            guard = Optional.of(predicate);
            return this;
        }

        public SpacingDsl noSpace() {
            return action(WhitespaceAction.NO_SPACE);
        }

        public SpacingDsl singleSpace() {
            return action(WhitespaceAction.SINGLE_SPACE);
        }

        public SpacingDsl noSpaceOrNewline() {
            return action(WhitespaceAction.NO_SPACE_OR_NEWLINE);
        }

        public SpacingDsl singleSpaceOrNewline() {
            return action(WhitespaceAction.SINGLE_SPACE_OR_NEWLINE);
        }

        public SpacingDsl action(WhitespaceAction action) {
            checkState(anchor != null, "Directive needs an anchor token before its action");
            for (var side : sides) {
                dsl.register(new SpacingDirective(containerFilter, anchor, side, guard, action));
            }
            return dsl;
        }

        private RuleBuilder anchor(TokenKind kind, Side side) {
            checkState(anchor == null || anchor == kind, "Directive is already anchored on %s", anchor);
            checkArgument(!kind.isTrivia(), "Trivia cannot anchor a spacing directive: %s", kind);
            anchor = kind;
            sides.add(side);
            return this;
        }
    }
}
