package com.routerline.backend.compiler;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered token sequence addressing one node of the device configuration tree.
 * The empty path is only ever used by the mapper to say "this field does not exist at this version".
 */
public record Path(List<String> tokens) {

    public static final Path EMPTY = new Path(List.of());

    public Path {
        Objects.requireNonNull(tokens, "tokens");
        for (String t : tokens) {
            if (t == null || t.isBlank()) {
                throw new IllegalArgumentException("path tokens must be non-empty: " + tokens);
            }
        }
        tokens = List.copyOf(tokens);
    }

    public static Path of(String... tokens) {
        return new Path(Arrays.asList(tokens));
    }

    public boolean isEmpty() { return tokens.isEmpty(); }

    public int size() { return tokens.size(); }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
