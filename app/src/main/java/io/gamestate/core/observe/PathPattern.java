package io.gamestate.core.observe;

import io.gamestate.core.tree.Path;

/**
 * Observer pattern over dot paths. Matches a concrete path segment by segment:
 * same segment count, and every non-{@code *} segment textually equal.
 */
public final class PathPattern {

    private final Path tokens;
    private final boolean wildcard;

    private PathPattern(Path tokens) {
        this.tokens = tokens;
        this.wildcard = tokens.containsWildcard();
    }

    public static PathPattern compile(String pattern) {
        return new PathPattern(Path.parse(pattern));
    }

    public boolean isWildcard() { return wildcard; }
    public String text() { return tokens.text(); }

    public boolean matches(String concretePath) {
        if (!wildcard) {
            return tokens.text().equals(concretePath);
        }
        return matches(Path.parse(concretePath));
    }

    public boolean matches(Path concrete) {
        if (concrete.size() != tokens.size()) {
            return false;
        }
        for (int i = 0; i < tokens.size(); i++) {
            Path.Segment expected = tokens.segment(i);
            if (expected.isWildcard()) {
                continue;
            }
            if (!expected.text().equals(concrete.segment(i).text())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() { return tokens.text(); }
}
