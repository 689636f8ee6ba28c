package com.routerline.backend.compiler;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent table for declaring a feature grammar. A scope prefixes both the operation name
 * (dot separated) and the path template of everything declared through it.
 *
 * <pre>
 * var rule = g.node("rule", "nat source rule {rule}");
 * rule.leaf("description", "description {value}");   // rule.description
 * </pre>
 */
public final class GrammarBuilder {

    private final Map<String, OperationSpec> ops;
    private final String namePrefix;
    private final String templatePrefix;

    private GrammarBuilder(Map<String, OperationSpec> ops, String namePrefix, String templatePrefix) {
        this.ops = ops;
        this.namePrefix = namePrefix;
        this.templatePrefix = templatePrefix;
    }

    public static GrammarBuilder root() {
        return new GrammarBuilder(new LinkedHashMap<>(), "", "");
    }

    /** Nested scope without declaring an operation for the scope itself. */
    public GrammarBuilder scope(String name, String template) {
        return new GrammarBuilder(ops, qualify(name) + ".", join(template));
    }

    /** Declares a NODE operation and returns a scope rooted at it. */
    public GrammarBuilder node(String name, String template) {
        put(OperationSpec.of(qualify(name), LeafKind.NODE, join(template)));
        return scope(name, template);
    }

    public GrammarBuilder presence(String name, String template) {
        put(OperationSpec.of(qualify(name), LeafKind.PRESENCE, join(template)));
        return this;
    }

    public GrammarBuilder leaf(String name, String template) {
        put(OperationSpec.of(qualify(name), LeafKind.LEAF, join(template)));
        return this;
    }

    public GrammarBuilder multi(String name, String template) {
        put(OperationSpec.of(qualify(name), LeafKind.MULTI, join(template)));
        return this;
    }

    public GrammarBuilder compound(String name, List<String> setTemplates, List<String> deleteTemplates) {
        put(OperationSpec.compound(
                qualify(name),
                setTemplates.stream().map(this::join).toList(),
                deleteTemplates.stream().map(this::join).toList()
        ));
        return this;
    }

    /** Restricts a parameter of an operation declared in this scope to a fixed vocabulary. */
    public GrammarBuilder allow(String name, String param, String... values) {
        String q = qualify(name);
        OperationSpec spec = ops.get(q);
        if (spec == null) throw new IllegalStateException("allow() on undeclared operation " + q);
        ops.put(q, spec.allowing(param, Set.copyOf(Arrays.asList(values))));
        return this;
    }

    /** Same as {@link #allow} for every operation declared so far in this scope that takes {@code param}. */
    public GrammarBuilder allowAll(String param, String... values) {
        Set<String> vocabulary = Set.copyOf(Arrays.asList(values));
        for (var e : ops.entrySet()) {
            if (e.getKey().startsWith(namePrefix) && e.getValue().parameters().contains(param)) {
                e.setValue(e.getValue().allowing(param, vocabulary));
            }
        }
        return this;
    }

    public Map<String, OperationSpec> build() {
        return Map.copyOf(ops);
    }

    private void put(OperationSpec spec) {
        if (ops.putIfAbsent(spec.name(), spec) != null) {
            throw new IllegalStateException("duplicate operation " + spec.name());
        }
    }

    private String qualify(String name) {
        return namePrefix + name;
    }

    private String join(String template) {
        return templatePrefix.isEmpty() ? template : templatePrefix + " " + template;
    }
}
