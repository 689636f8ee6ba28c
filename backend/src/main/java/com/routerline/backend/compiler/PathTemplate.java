package com.routerline.backend.compiler;

import com.routerline.backend.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A path pattern such as {@code "firewall group address-group {name} address {value}"}.
 * <p>
 * Literal words are emitted as-is, {@code {param}} is replaced by the named parameter and
 * {@code {param*}} is split on whitespace into several tokens (tcp flag lists and the like).
 */
public final class PathTemplate {

    public static final String VALUE = "value";

    private record Segment(String text, boolean placeholder, boolean splat) {}

    private final String pattern;
    private final List<Segment> segments;

    private PathTemplate(String pattern, List<Segment> segments) {
        this.pattern = pattern;
        this.segments = List.copyOf(segments);
    }

    public static PathTemplate parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("template must not be blank");
        }
        List<Segment> segs = new ArrayList<>();
        for (String word : pattern.trim().split("\\s+")) {
            if (word.startsWith("{") && word.endsWith("}")) {
                String name = word.substring(1, word.length() - 1);
                boolean splat = name.endsWith("*");
                if (splat) name = name.substring(0, name.length() - 1);
                if (name.isEmpty()) throw new IllegalArgumentException("empty placeholder in " + pattern);
                segs.add(new Segment(name, true, splat));
            } else {
                segs.add(new Segment(word, false, false));
            }
        }
        return new PathTemplate(pattern.trim(), segs);
    }

    public String pattern() { return pattern; }

    public Set<String> parameters() {
        Set<String> out = new LinkedHashSet<>();
        for (Segment s : segments) {
            if (s.placeholder()) out.add(s.text());
        }
        return out;
    }

    public boolean endsWithValue() {
        Segment last = segments.get(segments.size() - 1);
        return last.placeholder() && VALUE.equals(last.text());
    }

    public PathTemplate withoutTrailingValue() {
        if (!endsWithValue()) return this;
        List<Segment> head = segments.subList(0, segments.size() - 1);
        StringBuilder sb = new StringBuilder();
        for (Segment s : head) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(s.placeholder() ? "{" + s.text() + (s.splat() ? "*" : "") + "}" : s.text());
        }
        return new PathTemplate(sb.toString(), head);
    }

    /**
     * Substitutes parameters. A missing or blank parameter is a {@link ValidationException} naming the operation.
     */
    public Path render(String operation, Map<String, String> params) {
        List<String> tokens = new ArrayList<>(segments.size() + 2);
        for (Segment s : segments) {
            if (!s.placeholder()) {
                tokens.add(s.text());
                continue;
            }
            String v = params.get(s.text());
            if (v == null || v.isBlank()) {
                if (VALUE.equals(s.text())) {
                    throw new ValidationException("Operation " + operation + " requires a value");
                }
                throw new ValidationException("Operation " + operation + " requires '" + s.text() + "'");
            }
            if (s.splat()) {
                for (String part : v.trim().split("\\s+")) tokens.add(part);
            } else {
                tokens.add(v);
            }
        }
        return new Path(tokens);
    }

    @Override
    public String toString() { return pattern; }
}
