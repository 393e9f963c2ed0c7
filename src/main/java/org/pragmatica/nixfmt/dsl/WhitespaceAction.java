package org.pragmatica.nixfmt.dsl;

/**
 * What a spacing directive puts into a gap.
 *
 * <p>The {@code _OR_NEWLINE} actions keep one line break (followed by the
 * indentation of the next line) where the original text was broken; otherwise
 * they fall back to their base spacing. See {@link SpacingMatch#breaksLine()}.
 */
public enum WhitespaceAction {
    NO_SPACE("", false),
    SINGLE_SPACE(" ", false),
    NO_SPACE_OR_NEWLINE("", true),
    SINGLE_SPACE_OR_NEWLINE(" ", true);

    private final String spacing;
    private final boolean keepsLineBreak;

    WhitespaceAction(String spacing, boolean keepsLineBreak) {
        this.spacing = spacing;
        this.keepsLineBreak = keepsLineBreak;
    }

    /**
     * Text rendered when no line break is kept.
     */
    public String spacing() {
        return spacing;
    }

    public boolean keepsLineBreak() {
        return keepsLineBreak;
    }

    /**
     * Whether the gap gets a line break, given whether the original layout was broken there.
     */
    public boolean breaksLine(boolean originallyBroken) {
        return keepsLineBreak && originallyBroken;
    }
}
