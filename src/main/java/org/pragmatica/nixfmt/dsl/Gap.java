package org.pragmatica.nixfmt.dsl;

import org.pragmatica.nixfmt.tree.SyntaxToken;

/**
 * The whitespace between two adjacent significant tokens (comments included).
 *
 * @param left       token before the gap
 * @param right      token after the gap
 * @param whitespace original whitespace between them, possibly empty
 */
public record Gap(SyntaxToken left, SyntaxToken right, String whitespace) {

    /**
     * The token a directive with the given side is anchored on: a directive
     * acting {@code BEFORE} its anchor sees the right token, {@code AFTER} the left one.
     */
    public SyntaxToken anchor(Side side) {
        return side == Side.BEFORE
               ? right
               : left;
    }

    public boolean hasLineBreak() {
        return whitespace.indexOf('\n') >= 0;
    }

    public int lineBreaks() {
        return (int) whitespace.chars()
                               .filter(c -> c == '\n')
                               .count();
    }
}
