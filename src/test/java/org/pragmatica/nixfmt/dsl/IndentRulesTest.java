package org.pragmatica.nixfmt.dsl;

import org.junit.jupiter.api.Test;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndentRulesTest {

    private static final IndentRules RULES = new IndentDsl()
        .inside(NodeKind.LIST).indent(NodeKind.VALUE, TokenKind.COMMENT)
        .inside(NodeKind.SET, NodeKind.LET_IN).indent(NodeKind.SET_ENTRY)
        .build();

    private static SyntaxToken token(SyntaxNode root, String text) {
        return root.tokens()
                   .stream()
                   .filter(token -> token.text()
                                         .equals(text))
                   .findFirst()
                   .orElseThrow();
    }

    @Test
    void indentLevelOf_rootIsZero() {
        var root = Gaps.parse("{ a = 1; }");

        assertEquals(0, RULES.indentLevelOf(root));
        assertEquals(0, RULES.indentLevelOf(root.children()
                                                .get(0)));
    }

    @Test
    void indentLevelOf_addsOneLevelPerMatchingOwner() {
        var root = Gaps.parse("{\n  a = [\n    1\n  ];\n}");
        var entry = token(root, "a").parent()
                                    .flatMap(SyntaxNode::parent)
                                    .flatMap(SyntaxNode::parent)
                                    .orElseThrow();
        var value = token(root, "1").parent()
                                    .orElseThrow();

        assertEquals(NodeKind.SET_ENTRY, entry.kind());
        assertEquals(1, RULES.indentLevelOf(entry));
        assertEquals(2, RULES.indentLevelOf(value));
        assertEquals(1, RULES.indentLevelOf(token(root, "]")));
        assertEquals(0, RULES.indentLevelOf(token(root, "}")));
    }

    @Test
    void indentLevelOf_countsCommentsAsChildren() {
        var root = Gaps.parse("[\n  # first\n  1\n]");

        assertEquals(1, RULES.indentLevelOf(token(root, "# first")));
    }

    @Test
    void indentLevelOf_letBindingsShareOwnerGroup() {
        var root = Gaps.parse("let\n  a = 1;\nin\n  a");
        var entry = token(root, "a").parent()
                                    .flatMap(SyntaxNode::parent)
                                    .flatMap(SyntaxNode::parent)
                                    .orElseThrow();

        assertEquals(1, RULES.indentLevelOf(entry));
    }

    @Test
    void indentLevelOf_withoutDirectives_isAlwaysZero() {
        var rules = new IndentDsl().build();
        var root = Gaps.parse("[ [ 1 ] ]");

        assertEquals(0, rules.indentLevelOf(token(root, "1")));
    }

    @Test
    void directive_matchesOwnerAndChildKinds() {
        var directive = RULES.directives()
                             .get(0);

        assertTrue(directive.matches(NodeKind.LIST, TokenKind.COMMENT));
        assertFalse(directive.matches(NodeKind.SET, TokenKind.COMMENT));
        assertFalse(directive.matches(NodeKind.LIST, NodeKind.SET_ENTRY));
    }

    @Test
    void builder_rejectsEmptyKindLists() {
        assertThrows(IllegalArgumentException.class, () -> new IndentDsl().inside(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new IndentDsl().inside(NodeKind.LIST)
                                                                        .indent(List.of()));
    }
}
