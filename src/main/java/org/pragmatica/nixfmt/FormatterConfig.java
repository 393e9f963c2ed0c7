package org.pragmatica.nixfmt;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Formatter configuration options.
 *
 * @param indentWidth            spaces per indentation level
 * @param terminatorAfterLiteral how a {@code ;} directly after a set or list literal is treated
 */
public record FormatterConfig(
    int indentWidth,
    TerminatorPolicy terminatorAfterLiteral
) {
    public static final FormatterConfig DEFAULT = new FormatterConfig(
        2,
        TerminatorPolicy.STRICT
    );

    public FormatterConfig {
        checkArgument(indentWidth > 0, "Indent width must be positive, got %s", indentWidth);
        checkArgument(terminatorAfterLiteral != null, "Terminator policy is required");
    }

    /**
     * Treatment of the binding terminator in {@code a = [ ... ];} and {@code a = { ... };}.
     */
    public enum TerminatorPolicy {
        /** Always glue the {@code ;} to the closing bracket, removing any line break. */
        STRICT,
        /** Glue it unless the source already had a line break in front of it. */
        KEEP_EXISTING_NEWLINE
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int indentWidth = DEFAULT.indentWidth();
        private TerminatorPolicy terminatorAfterLiteral = DEFAULT.terminatorAfterLiteral();

        private Builder() {}

        public Builder indentWidth(int width) {
            this.indentWidth = width;
            return this;
        }

        public Builder terminatorAfterLiteral(TerminatorPolicy policy) {
            this.terminatorAfterLiteral = policy;
            return this;
        }

        public FormatterConfig build() {
            return new FormatterConfig(indentWidth, terminatorAfterLiteral);
        }
    }
}
