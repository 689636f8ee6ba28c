package com.routerline.backend.grammar;

import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.ResolvedMapper;
import com.routerline.backend.compiler.VersionResolver;
import com.routerline.backend.compiler.VersionTag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GrammarConfigTest {

    @Test
    void all_registersOneGrammarPerFamily() {
        Set<FeatureFamily> seen = EnumSet.noneOf(FeatureFamily.class);
        for (FeatureGrammar g : GrammarConfig.all()) {
            assertTrue(seen.add(g.family()), "duplicate " + g.family());
        }
        assertEquals(EnumSet.allOf(FeatureFamily.class), seen);
    }

    @Test
    void everyFamily_resolvesAtEveryVersion() {
        VersionResolver resolver = new VersionResolver(GrammarConfig.all());

        for (FeatureFamily f : FeatureFamily.values()) {
            for (VersionTag v : VersionTag.values()) {
                ResolvedMapper m = resolver.forTag(f, v);
                assertFalse(m.operationNames().isEmpty(), f + "@" + v);
                assertFalse(m.capabilities().features().isEmpty(), f + "@" + v);
                for (String op : m.operationNames()) {
                    OperationSpec spec = m.spec(op);
                    assertEquals(op, spec.name());
                }
            }
        }
    }

    @Test
    void operationNames_areTheSameAtEveryVersion() {
        VersionResolver resolver = new VersionResolver(GrammarConfig.all());

        for (FeatureFamily f : FeatureFamily.values()) {
            Set<String> v14 = resolver.forTag(f, VersionTag.V1_4).operationNames();
            Set<String> v15 = resolver.forTag(f, VersionTag.V1_5).operationNames();
            assertEquals(v14, v15, f.id());
        }
    }
}
