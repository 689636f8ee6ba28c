package com.routerline.backend.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One set/delete unit of a batch. A set without a value creates a presence node; a value,
 * when present, travels to the device as the trailing path token.
 */
public record Instruction(Kind kind, Path path, String value) {

    public enum Kind {
        SET,
        DELETE;

        public String wireName() { return name().toLowerCase(Locale.ROOT); }
    }

    public Instruction {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) throw new IllegalArgumentException("instruction path must not be empty");
        if (value != null && value.isEmpty()) throw new IllegalArgumentException("instruction value must not be empty");
        if (kind == Kind.DELETE && value != null) throw new IllegalArgumentException("delete carries no value");
    }

    public static Instruction set(Path path) { return new Instruction(Kind.SET, path, null); }
    public static Instruction set(Path path, String value) { return new Instruction(Kind.SET, path, value); }
    public static Instruction delete(Path path) { return new Instruction(Kind.DELETE, path, null); }

    /** Path tokens as sent on the wire, value last. */
    public List<String> wirePath() {
        if (value == null) return path.tokens();
        List<String> out = new ArrayList<>(path.tokens());
        out.add(value);
        return out;
    }

    @Override
    public String toString() {
        return kind.wireName() + " " + String.join(" ", wirePath());
    }
}
