package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxKind;

/**
 * Elements of a {@code childKinds} kind sitting directly under a node of an
 * {@code ownerKinds} kind get one more indentation level than their parent.
 */
public record IndentDirective(ImmutableSet<NodeKind> ownerKinds, ImmutableSet<SyntaxKind> childKinds) {

    public boolean matches(NodeKind owner, SyntaxKind child) {
        return ownerKinds.contains(owner) && childKinds.contains(child);
    }
}
