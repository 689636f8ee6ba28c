package com.routerline.backend.compiler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Version-specific adjustments layered over a base grammar. Every override must target an operation
 * the base declares, so a typo fails when the grammar is first resolved instead of at request time.
 */
public final class GrammarOverrides {

    private final Map<String, OperationSpec> base;
    private final Map<String, OperationSpec> out = new LinkedHashMap<>();

    public GrammarOverrides(Map<String, OperationSpec> base) {
        this.base = base;
    }

    /** Operation {@code prefix} and everything beneath it raise a CapabilityException. */
    public GrammarOverrides unsupported(String prefix, String reason) {
        return unsupported(n -> n.equals(prefix) || n.startsWith(prefix + "."), reason, prefix);
    }

    public GrammarOverrides unsupported(Predicate<String> names, String reason, String label) {
        int hits = 0;
        for (var e : base.entrySet()) {
            if (names.test(e.getKey())) {
                out.put(e.getKey(), current(e.getKey()).unsupported(reason));
                hits++;
            }
        }
        if (hits == 0) throw new IllegalStateException("unsupported(" + label + ") matches no operation");
        return this;
    }

    /** The field does not exist at this version; it resolves to an empty path and is skipped. */
    public GrammarOverrides absent(String name) {
        out.put(name, current(name).absent());
        return this;
    }

    /** Same operation, different location in the tree. */
    public GrammarOverrides reshape(String name, String template) {
        OperationSpec old = current(name);
        OperationSpec next = OperationSpec.of(name, old.kind(), template);
        for (var e : old.allowedValues().entrySet()) next = next.allowing(e.getKey(), e.getValue());
        out.put(name, next);
        return this;
    }

    public Map<String, OperationSpec> build() {
        return Map.copyOf(out);
    }

    private OperationSpec current(String name) {
        OperationSpec spec = out.containsKey(name) ? out.get(name) : base.get(name);
        if (spec == null) throw new IllegalStateException("override for unknown operation " + name);
        return spec;
    }
}
