package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableList;
import org.pragmatica.nixfmt.tree.SyntaxElement;
import org.pragmatica.nixfmt.tree.SyntaxNode;

import java.util.List;

/**
 * Immutable registry of indentation directives.
 */
public final class IndentRules {
    private final ImmutableList<IndentDirective> directives;

    IndentRules(List<IndentDirective> directives) {
        this.directives = ImmutableList.copyOf(directives);
    }

    public List<IndentDirective> directives() {
        return directives;
    }

    /**
     * Indentation level of an element: its parent's level, plus one if some
     * directive indents this element's kind under the parent's kind. The root is at level 0.
     */
    public int indentLevelOf(SyntaxElement element) {
        int level = 0;
        var current = element;
        var parent = current.parent();
        while (parent.isPresent()) {
            if (indents(parent.get(), current)) {
                level++ ;
            }
            current = parent.get();
            parent = current.parent();
        }
        return level;
    }

    private boolean indents(SyntaxNode owner, SyntaxElement child) {
        return directives.stream()
                         .anyMatch(directive -> directive.matches(owner.kind(), child.kind()));
    }
}
