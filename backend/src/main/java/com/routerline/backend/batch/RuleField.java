package com.routerline.backend.batch;

import java.util.Map;
import java.util.Objects;

/**
 * One field assignment replayed onto a renumbered rule, e.g. {@code ("rule.action", {value=accept})}.
 */
public record RuleField(String operation, Map<String, String> params) {

    public RuleField {
        Objects.requireNonNull(operation, "operation");
        params = (params == null) ? Map.of() : Map.copyOf(params);
    }

    public static RuleField of(String operation, String value) {
        return new RuleField(operation, Map.of("value", value));
    }

    public static RuleField flag(String operation) {
        return new RuleField(operation, Map.of());
    }
}
