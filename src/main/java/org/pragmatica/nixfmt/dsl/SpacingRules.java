package org.pragmatica.nixfmt.dsl;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered registry of spacing directives.
 *
 * <p>Precedence: among the directives matching a gap, guarded ones are tried
 * first in registration order and the first whose guard holds wins; failing
 * that, the first unguarded match in registration order wins. A gap without
 * any match is unresolved and left to the formatter's default.
 */
public final class SpacingRules {
    private final ImmutableList<SpacingDirective> directives;

    SpacingRules(List<SpacingDirective> directives) {
        this.directives = ImmutableList.copyOf(directives);
    }

    public List<SpacingDirective> directives() {
        return directives;
    }

    /**
     * The directive deciding the given gap, if any.
     */
    public Optional<SpacingMatch> resolve(Gap gap) {
        return select(candidates(gap));
    }

    /**
     * All directives matching the gap (guards not yet evaluated), in registration order.
     */
    public List<SpacingMatch> candidates(Gap gap) {
        var matches = new ArrayList<SpacingMatch>();
        for (var directive : directives) {
            directive.match(gap)
                     .ifPresent(matches::add);
        }
        return matches;
    }

    /**
     * Picks the winner among matches given in registration order.
     */
    public static Optional<SpacingMatch> select(List<SpacingMatch> candidates) {
        for (var candidate : candidates) {
            if (candidate.isGuarded() && candidate.guardHolds()) {
                return Optional.of(candidate);
            }
        }
        return candidates.stream()
                         .filter(candidate -> !candidate.isGuarded())
                         .findFirst();
    }
}
