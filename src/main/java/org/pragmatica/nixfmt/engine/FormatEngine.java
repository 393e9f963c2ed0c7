package org.pragmatica.nixfmt.engine;

import com.google.common.base.Strings;
import org.pragmatica.nixfmt.FormatterConfig;
import org.pragmatica.nixfmt.dsl.Gap;
import org.pragmatica.nixfmt.dsl.IndentRules;
import org.pragmatica.nixfmt.dsl.SpacingMatch;
import org.pragmatica.nixfmt.dsl.SpacingRules;
import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxQueries;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Emits formatted text for a syntax tree in one left-to-right pass over its
 * leaves. Each gap between two significant tokens is decided by the spacing
 * rules; every line gets the indentation of the element it starts with.
 *
 * <p>Gaps no directive resolves keep their original spaces; when they hold
 * line breaks, at most one blank line survives and the indentation is recomputed.
 */
public final class FormatEngine {
    private static final Logger log = LoggerFactory.getLogger(FormatEngine.class);
    private static final int MAX_LINE_BREAKS = 2;

    private final SpacingRules spacing;
    private final IndentRules indentation;
    private final FormatterConfig config;

    private FormatEngine(SpacingRules spacing, IndentRules indentation, FormatterConfig config) {
        this.spacing = spacing;
        this.indentation = indentation;
        this.config = config;
    }

    public static FormatEngine create(SpacingRules spacing, IndentRules indentation, FormatterConfig config) {
        return new FormatEngine(spacing, indentation, config);
    }

    public String format(SyntaxNode root) {
        var out = new StringBuilder();
        var whitespace = new StringBuilder();
        SyntaxToken previous = null;
        int gaps = 0;
        int resolved = 0;
        for (var token : root.tokens()) {
            if (token.kind() == TokenKind.WHITESPACE) {
                whitespace.append(token.text());
                continue;
            }
            if (previous != null) {
                var gap = new Gap(previous, token, whitespace.toString());
                var match = spacing.resolve(gap);
                out.append(render(gap, match));
                gaps++ ;
                if (match.isPresent()) {
                    resolved++ ;
                }
            }
            out.append(token.text());
            whitespace.setLength(0);
            previous = token;
        }
        if (whitespace.indexOf("\n") >= 0) {
            out.append('\n');
        }
        log.debug("Formatted {} gaps, {} decided by spacing directives", gaps, resolved);
        return out.toString();
    }

    private String render(Gap gap, Optional<SpacingMatch> match) {
        String rendered;
        if (match.isPresent()) {
            rendered = match.get()
                            .breaksLine()
                       ? lineBreak(gap.right(), 1)
                       : match.get()
                              .action()
                              .spacing();
        }else {
            rendered = gap.hasLineBreak()
                       ? lineBreak(gap.right(), Math.min(gap.lineBreaks(), MAX_LINE_BREAKS))
                       : gap.whitespace();
        }
        // a line comment runs to the end of its line
        if (gap.left()
               .isLineComment() && rendered.indexOf('\n') < 0) {
            return lineBreak(gap.right(), 1);
        }
        return rendered;
    }

    private String lineBreak(SyntaxToken next, int count) {
        int level = indentation.indentLevelOf(SyntaxQueries.lineStart(next));
        return Strings.repeat("\n", count) + Strings.repeat(" ", level * config.indentWidth());
    }
}
