package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fluent builder for {@link IndentRules}:
 * {@code new IndentDsl().inside(NodeKind.LIST).indent(NodeKind.VALUE, TokenKind.COMMENT)}.
 */
public final class IndentDsl {
    private final List<IndentDirective> directives = new ArrayList<>();

    public OwnerBuilder inside(NodeKind... owners) {
        return inside(Arrays.asList(owners));
    }

    public OwnerBuilder inside(Collection<NodeKind> owners) {
        checkArgument(!owners.isEmpty(), "Indent directive needs at least one owner kind");
        return new OwnerBuilder(this, ImmutableSet.copyOf(owners));
    }

    public IndentRules build() {
        return new IndentRules(directives);
    }

    public static final class OwnerBuilder {
        private final IndentDsl dsl;
        private final ImmutableSet<NodeKind> owners;

        private OwnerBuilder(IndentDsl dsl, ImmutableSet<NodeKind> owners) {
            this.dsl = dsl;
            this.owners = owners;
        }

        public IndentDsl indent(SyntaxKind... children) {
            return indent(Arrays.asList(children));
        }

        public IndentDsl indent(Collection<? extends SyntaxKind> children) {
            checkArgument(!children.isEmpty(), "Indent directive needs at least one child kind");
            dsl.directives.add(new IndentDirective(owners, ImmutableSet.copyOf(children)));
            return dsl;
        }
    }
}
