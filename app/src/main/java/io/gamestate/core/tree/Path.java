package io.gamestate.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dot-separated path split into typed segments.
 * Canonical non-negative integers ("0", "12") are sequence indices, "*" is a
 * single-level wildcard and everything else is a mapping key.
 */
public final class Path {

    public static final String WILDCARD = "*";

    public enum Kind { KEY, INDEX, WILDCARD }

    /** One token of a path. {@code index} is -1 unless the kind is INDEX. */
    public record Segment(Kind kind, String text, int index) {

        public static Segment of(String text) {
            if (WILDCARD.equals(text)) {
                return new Segment(Kind.WILDCARD, text, -1);
            }
            int index = parseIndex(text);
            return index >= 0 ? new Segment(Kind.INDEX, text, index) : new Segment(Kind.KEY, text, -1);
        }

        public boolean isWildcard() { return kind == Kind.WILDCARD; }
        public boolean isIndex() { return kind == Kind.INDEX; }

        @Override
        public String toString() { return text; }
    }

    private final String text;
    private final List<Segment> segments;

    private Path(String text, List<Segment> segments) {
        this.text = text;
        this.segments = segments;
    }

    public static Path parse(String path) {
        Objects.requireNonNull(path, "path");
        String[] parts = path.split("\\.", -1);
        List<Segment> out = new ArrayList<>(parts.length);
        for (String part : parts) {
            out.add(Segment.of(part));
        }
        return new Path(path, Collections.unmodifiableList(out));
    }

    public String text() { return text; }
    public List<Segment> segments() { return segments; }
    public int size() { return segments.size(); }
    public Segment segment(int i) { return segments.get(i); }
    public Segment last() { return segments.get(segments.size() - 1); }

    public boolean hasParent() { return segments.size() > 1; }

    /** Path without its last segment; null for single-segment paths. */
    public Path parent() {
        if (!hasParent()) {
            return null;
        }
        return new Path(text.substring(0, text.lastIndexOf('.')), segments.subList(0, segments.size() - 1));
    }

    public boolean containsWildcard() {
        for (Segment s : segments) {
            if (s.isWildcard()) return true;
        }
        return false;
    }

    /** Joins a parent path string and a child key the way diff paths are built. */
    public static String join(String parent, String child) {
        return parent.isEmpty() ? child : parent + "." + child;
    }

    private static int parseIndex(String text) {
        int len = text.length();
        if (len == 0 || len > 9) {
            return -1;
        }
        if (len > 1 && text.charAt(0) == '0') {
            return -1;
        }
        int value = 0;
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path other)) return false;
        return text.equals(other.text);
    }

    @Override
    public int hashCode() { return text.hashCode(); }

    @Override
    public String toString() { return text; }
}
