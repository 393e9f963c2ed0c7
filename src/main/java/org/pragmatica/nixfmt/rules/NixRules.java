package org.pragmatica.nixfmt.rules;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.nixfmt.FormatterConfig;
import org.pragmatica.nixfmt.FormatterConfig.TerminatorPolicy;
import org.pragmatica.nixfmt.dsl.IndentDsl;
import org.pragmatica.nixfmt.dsl.IndentRules;
import org.pragmatica.nixfmt.dsl.SpacingDsl;
import org.pragmatica.nixfmt.dsl.SpacingRules;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SyntaxElement;
import org.pragmatica.nixfmt.tree.SyntaxQueries;

import java.util.function.Predicate;

import static org.pragmatica.nixfmt.tree.NodeKind.ASSERT;
import static org.pragmatica.nixfmt.tree.NodeKind.INDEX_SET;
import static org.pragmatica.nixfmt.tree.NodeKind.INHERIT;
import static org.pragmatica.nixfmt.tree.NodeKind.LAMBDA;
import static org.pragmatica.nixfmt.tree.NodeKind.LET_IN;
import static org.pragmatica.nixfmt.tree.NodeKind.LIST;
import static org.pragmatica.nixfmt.tree.NodeKind.OPERATION;
import static org.pragmatica.nixfmt.tree.NodeKind.PAREN;
import static org.pragmatica.nixfmt.tree.NodeKind.SET;
import static org.pragmatica.nixfmt.tree.NodeKind.SET_ENTRY;
import static org.pragmatica.nixfmt.tree.NodeKind.STRING;
import static org.pragmatica.nixfmt.tree.NodeKind.VALUE;
import static org.pragmatica.nixfmt.tree.NodeKind.WITH;
import static org.pragmatica.nixfmt.tree.SyntaxQueries.childOf;
import static org.pragmatica.nixfmt.tree.TokenKind.ASSIGN;
import static org.pragmatica.nixfmt.tree.TokenKind.COLON;
import static org.pragmatica.nixfmt.tree.TokenKind.COMMENT;
import static org.pragmatica.nixfmt.tree.TokenKind.CONCAT;
import static org.pragmatica.nixfmt.tree.TokenKind.DOT;
import static org.pragmatica.nixfmt.tree.TokenKind.EQUAL;
import static org.pragmatica.nixfmt.tree.TokenKind.L_BRACE;
import static org.pragmatica.nixfmt.tree.TokenKind.L_BRACK;
import static org.pragmatica.nixfmt.tree.TokenKind.NOT_EQUAL;
import static org.pragmatica.nixfmt.tree.TokenKind.R_BRACE;
import static org.pragmatica.nixfmt.tree.TokenKind.R_BRACK;
import static org.pragmatica.nixfmt.tree.TokenKind.SEMICOLON;
import static org.pragmatica.nixfmt.tree.TokenKind.UPDATE;

/**
 * Formatting rules for the Nix language. Changing how Nix code is laid out
 * means editing these tables; the registries interpreting them stay untouched.
 * Constructs no directive mentions keep their original spacing.
 */
public final class NixRules {
    private NixRules() {}

    static final ImmutableSet<NodeKind> ENTRY_OWNERS = ImmutableSet.of(SET, LET_IN);

    static final ImmutableSet<NodeKind> LIST_ELEMENTS = ImmutableSet.of(
        VALUE,
        LIST,
        SET,
        INDEX_SET,
        LAMBDA,
        STRING,
        PAREN,
        NodeKind.IDENT
    );

    public static SpacingRules spacing(FormatterConfig config) {
        // Note: comments with a fat arrow are test cases, checked against the text of this file.
        var dsl = new SpacingDsl();

        dsl
            // { a=92; } => { a = 92; }
            .inside(SET_ENTRY).around(ASSIGN).singleSpace()

            // { a = 92 ; } => { a = 92; }
            .inside(SET_ENTRY).before(SEMICOLON).noSpaceOrNewline()
            // { a = [ 1 ] ; } => { a = [ 1 ]; }
            .inside(SET_ENTRY).before(SEMICOLON).when(terminatorAfterLiteral(config)).noSpace()

            // { inherit a b ; } => { inherit a b; }
            // with pkgs ; hello => with pkgs; hello
            .before(SEMICOLON).when(childOf(INHERIT, WITH, ASSERT)).noSpace()

            // a==  b => a == b
            .inside(OPERATION).around(EQUAL).singleSpace()
            // a!=b => a != b
            .inside(OPERATION).around(NOT_EQUAL).singleSpace()
            // a//b => a // b
            .inside(OPERATION).around(UPDATE).singleSpace()

            // a++  b => a ++ b
            .inside(OPERATION).after(CONCAT).singleSpace()
            .inside(OPERATION).before(CONCAT).singleSpaceOrNewline()

            // foo . bar . baz => foo.bar.baz
            .inside(INDEX_SET).around(DOT).noSpace()

            // x : x => x: x
            // {} : 92 => {}: 92
            .inside(LAMBDA).before(COLON).noSpace()

            // [1 2 3] => [ 1 2 3 ]
            .inside(LIST).after(L_BRACK).singleSpaceOrNewline()
            .inside(LIST).before(R_BRACK).singleSpaceOrNewline()

            // {foo = 92;} => { foo = 92; }
            // { g = {a}: a; } => { g = {a}: a; }
            .after(L_BRACE).when(childOf(SET)).singleSpaceOrNewline()
            .before(R_BRACE).when(childOf(SET)).singleSpaceOrNewline();

        return dsl.build();
    }

    public static IndentRules indentation() {
        return new IndentDsl()
            .inside(LIST).indent(LIST_ELEMENTS)
            .inside(ENTRY_OWNERS).indent(SET_ENTRY, INHERIT)

            // comments sit among the entries, so they take the same indent
            .inside(LIST).indent(COMMENT)
            .inside(ENTRY_OWNERS).indent(COMMENT)
            .build();
    }

    private static Predicate<SyntaxElement> terminatorAfterLiteral(FormatterConfig config) {
        Predicate<SyntaxElement> afterLiteral = SyntaxQueries::afterLiteral;
        return config.terminatorAfterLiteral() == TerminatorPolicy.STRICT
               ? afterLiteral
               : afterLiteral.and(element -> !SyntaxQueries.lineBreakBefore(element));
    }
}
