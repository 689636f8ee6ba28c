package com.routerline.backend.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which sub-features of a family exist at one firmware version. Immutable, cached with the mapper.
 */
public record CapabilityMatrix(FeatureFamily family, VersionTag version, Map<String, Capability> features) {

    public CapabilityMatrix {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public boolean supports(String flag) {
        Capability c = features.get(flag);
        return c != null && c.supported();
    }
}
