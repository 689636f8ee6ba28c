package com.routerline.backend.compiler;

import com.routerline.backend.error.CapabilityException;
import com.routerline.backend.error.UnknownOperationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VersionResolverTest {

    @Test
    void forVersion_returnsSameMapper_forSameFamilyAndTag() {
        VersionResolver resolver = new VersionResolver(List.of(new TinyGrammar()));

        ResolvedMapper a = resolver.forVersion(FeatureFamily.NAT, "1.4.1");
        ResolvedMapper b = resolver.forVersion(FeatureFamily.NAT, "1.4");

        assertSame(a, b);
        assertEquals(VersionTag.V1_4, a.version());
    }

    @Test
    void spec_prefersOverride_thenFallsBackToBase() {
        VersionResolver resolver = new VersionResolver(List.of(new TinyGrammar()));
        ResolvedMapper v14 = resolver.forTag(FeatureFamily.NAT, VersionTag.V1_4);
        ResolvedMapper v15 = resolver.forTag(FeatureFamily.NAT, VersionTag.V1_5);

        Map<String, String> p = Map.of("value", "x");
        assertEquals(List.of("old", "place", "x"), v14.resolve("moved", p).tokens());
        assertEquals(List.of("new", "place", "x"), v15.resolve("moved", p).tokens());
        assertEquals(v14.resolve("shared", p), v15.resolve("shared", p));
    }

    @Test
    void resolve_absentField_isEmptyPath() {
        ResolvedMapper v14 = new VersionResolver(List.of(new TinyGrammar())).forTag(FeatureFamily.NAT, VersionTag.V1_4);

        assertTrue(v14.resolve("gone", Map.of("value", "1")).isEmpty());
        assertFalse(v14.supports("gone"));
    }

    @Test
    void resolve_unsupportedFeature_namesRunningVersion() {
        ResolvedMapper v14 = new VersionResolver(List.of(new TinyGrammar())).forTag(FeatureFamily.NAT, VersionTag.V1_4);

        var e = assertThrows(CapabilityException.class, () -> v14.resolve("fresh", Map.of()));

        assertEquals("Fresh needs VyOS 1.5+. Current device is running v1.4", e.getMessage());
        assertEquals("fresh", e.getOperation());
        assertEquals(VersionTag.V1_4, e.getVersion());
    }

    @Test
    void resolve_unknownOperation_isRejected() {
        ResolvedMapper m = new VersionResolver(List.of(new TinyGrammar())).forTag(FeatureFamily.NAT, VersionTag.V1_5);

        var e = assertThrows(UnknownOperationException.class, () -> m.resolve("nope", Map.of()));
        assertEquals("nope", e.getOperation());
    }

    @Test
    void constructor_rejectsTwoGrammarsForOneFamily() {
        assertThrows(IllegalStateException.class, () -> new VersionResolver(List.of(new TinyGrammar(), new TinyGrammar())));
    }

    @Test
    void forTag_unregisteredFamily_fails() {
        VersionResolver resolver = new VersionResolver(List.of(new TinyGrammar()));

        assertFalse(resolver.knows(FeatureFamily.DHCP));
        assertThrows(IllegalStateException.class, () -> resolver.forTag(FeatureFamily.DHCP, VersionTag.V1_5));
    }

    static class TinyGrammar extends FeatureGrammar {

        @Override
        public FeatureFamily family() { return FeatureFamily.NAT; }

        @Override
        protected void define(GrammarBuilder g) {
            g.leaf("moved", "new place {value}");
            g.leaf("shared", "same place {value}");
            g.leaf("gone", "only new {value}");
            g.presence("fresh", "fresh feature");
        }

        @Override
        protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
            return switch (version) {
                case V1_4 -> o.reshape("moved", "old place {value}")
                        .absent("gone")
                        .unsupported("fresh", "Fresh needs VyOS 1.5+")
                        .build();
                case V1_5 -> o.build();
            };
        }

        @Override
        protected void describe(CapabilityTable t) {
            t.since(VersionTag.V1_5, "fresh", "Fresh feature");
        }
    }
}
