package org.pragmatica.nixfmt;

import org.pragmatica.nixfmt.engine.FormatEngine;
import org.pragmatica.nixfmt.error.FormatException;
import org.pragmatica.nixfmt.parser.NixParser;
import org.pragmatica.nixfmt.parser.ParseResult;
import org.pragmatica.nixfmt.rules.NixRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for formatting Nix source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var formatted = NixFormatter.reformat("{ a=92; }");
 * // "{ a = 92; }"
 *
 * var formatter = NixFormatter.builder()
 *                             .indentWidth(4)
 *                             .build();
 * formatter.format(source);
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads; every call
 * parses its own tree.
 */
public final class NixFormatter {
    private static final Logger log = LoggerFactory.getLogger(NixFormatter.class);
    private static final NixFormatter DEFAULT = nixFormatter(FormatterConfig.DEFAULT);

    private final FormatEngine engine;

    private NixFormatter(FormatEngine engine) {
        this.engine = engine;
    }

    /**
     * Create a formatter with the given configuration.
     */
    public static NixFormatter nixFormatter(FormatterConfig config) {
        return new NixFormatter(FormatEngine.create(NixRules.spacing(config), NixRules.indentation(), config));
    }

    /**
     * Format with the default configuration.
     *
     * @throws FormatException if the text does not parse
     */
    public static String reformat(String text) {
        return DEFAULT.format(text);
    }

    /**
     * Format source text.
     *
     * @throws FormatException if the text does not parse
     */
    public String format(String text) {
        var result = NixParser.parse(text);
        if (result instanceof ParseResult.Failure failure) {
            log.debug("Input rejected: {}", failure.error()
                                                  .message());
            throw new FormatException(failure.error());
        }
        return engine.format(result.unwrap());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final FormatterConfig.Builder config = FormatterConfig.builder();

        private Builder() {}

        public Builder indentWidth(int width) {
            config.indentWidth(width);
            return this;
        }

        public Builder terminatorAfterLiteral(FormatterConfig.TerminatorPolicy policy) {
            config.terminatorAfterLiteral(policy);
            return this;
        }

        public NixFormatter build() {
            return nixFormatter(config.build());
        }
    }
}
