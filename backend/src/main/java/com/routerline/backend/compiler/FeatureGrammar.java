package com.routerline.backend.compiler;

import java.util.Map;

/**
 * Declarative command grammar of one feature family.
 * <p>
 * {@link #define} declares the newest path shapes. {@link #overrides} adjusts them per version and is
 * written as a switch over {@link VersionTag}, so adding a tag fails to compile until every family
 * says what changes for it.
 */
public abstract class FeatureGrammar {

    public abstract FeatureFamily family();

    protected abstract void define(GrammarBuilder g);

    protected abstract Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o);

    protected abstract void describe(CapabilityTable t);

    public final Map<String, OperationSpec> baseOperations() {
        GrammarBuilder g = GrammarBuilder.root();
        define(g);
        return g.build();
    }

    public final Map<String, OperationSpec> overridesFor(VersionTag version, Map<String, OperationSpec> base) {
        return overrides(version, new GrammarOverrides(base));
    }

    public final CapabilityMatrix capabilities(VersionTag version) {
        CapabilityTable t = new CapabilityTable();
        describe(t);
        return t.evaluate(family(), version);
    }
}
