package org.pragmatica.nixfmt.dsl;

import org.junit.jupiter.api.Test;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpacingDslTest {

    @Test
    void build_keepsWritingOrder() {
        var rules = new SpacingDsl()
            .inside(NodeKind.SET_ENTRY).before(TokenKind.SEMICOLON).noSpace()
            .after(TokenKind.COLON).singleSpace()
            .inside(EnumSet.of(NodeKind.LIST)).before(TokenKind.R_BRACK).singleSpaceOrNewline()
            .build();

        assertThat(rules.directives()).extracting(SpacingDirective::anchor)
                                      .containsExactly(TokenKind.SEMICOLON, TokenKind.COLON, TokenKind.R_BRACK);
        assertThat(rules.directives().get(1)
                        .containerFilter()).isEmpty();
    }

    @Test
    void action_withoutAnchor_isRejected() {
        var builder = new SpacingDsl().inside(NodeKind.SET);

        assertThatThrownBy(builder::noSpace).isInstanceOf(IllegalStateException.class)
                                            .hasMessage("Directive needs an anchor token before its action");
    }

    @Test
    void anchor_cannotChangeWithinOneDirective() {
        var builder = new SpacingDsl().inside(NodeKind.SET).before(TokenKind.SEMICOLON);

        assertThatThrownBy(() -> builder.after(TokenKind.COLON)).isInstanceOf(IllegalStateException.class)
                                                                .hasMessage("Directive is already anchored on SEMICOLON");
    }

    @Test
    void anchor_cannotBeTrivia() {
        assertThatThrownBy(() -> new SpacingDsl().before(TokenKind.COMMENT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("COMMENT");
    }

    @Test
    void when_acceptsOneGuardOnly() {
        var builder = new SpacingDsl().before(TokenKind.SEMICOLON)
                                      .when(element -> true);

        assertThatThrownBy(() -> builder.when(element -> false)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inside_emptyFilter_isRejected() {
        assertThatThrownBy(() -> new SpacingDsl().inside(EnumSet.noneOf(NodeKind.class)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void directive_describesItself() {
        var rules = new SpacingDsl()
            .inside(NodeKind.SET_ENTRY).before(TokenKind.SEMICOLON).noSpace()
            .after(TokenKind.COLON).when(element -> true).singleSpace()
            .build();

        assertThat(rules.directives().get(0)).hasToString("inside [SET_ENTRY] before SEMICOLON: NO_SPACE");
        assertThat(rules.directives().get(1)).hasToString("after COLON when <guard>: SINGLE_SPACE");
    }
}
