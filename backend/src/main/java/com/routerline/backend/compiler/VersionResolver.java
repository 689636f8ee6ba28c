package com.routerline.backend.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class VersionResolver {

    private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

    private record Key(FeatureFamily family, VersionTag version) {}

    private final Map<FeatureFamily, FeatureGrammar> grammars = new EnumMap<>(FeatureFamily.class);
    private final Map<FeatureFamily, Map<String, OperationSpec>> bases = new EnumMap<>(FeatureFamily.class);
    private final Map<Key, ResolvedMapper> resolved = new ConcurrentHashMap<>();

    public VersionResolver(List<FeatureGrammar> grammars) {
        for (FeatureGrammar g : grammars) {
            if (this.grammars.putIfAbsent(g.family(), g) != null) {
                throw new IllegalStateException("two grammars registered for " + g.family());
            }
            bases.put(g.family(), g.baseOperations());
        }
        log.info("Loaded {} feature grammars", this.grammars.size());
    }

    public ResolvedMapper forVersion(FeatureFamily family, String rawVersion) {
        return forTag(family, VersionTag.fromRaw(rawVersion));
    }

    public ResolvedMapper forTag(FeatureFamily family, VersionTag tag) {
        return resolved.computeIfAbsent(new Key(family, tag), k -> build(k.family(), k.version()));
    }

    public boolean knows(FeatureFamily family) {
        return grammars.containsKey(family);
    }

    private ResolvedMapper build(FeatureFamily family, VersionTag tag) {
        FeatureGrammar g = grammars.get(family);
        if (g == null) throw new IllegalStateException("no grammar registered for " + family.id());

        Map<String, OperationSpec> base = bases.get(family);
        Map<String, OperationSpec> overrides = g.overridesFor(tag, base);
        log.debug("Resolved {} for v{} ({} operations, {} overrides)", family.id(), tag.label(), base.size(), overrides.size());
        return new ResolvedMapper(family, tag, overrides, base, g.capabilities(tag));
    }
}
