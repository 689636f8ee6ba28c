package com.routerline.backend.capability;

import com.routerline.backend.compiler.CapabilityMatrix;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.VersionResolver;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static feature tables per family and firmware. Never talks to a device.
 */
@Service
public class CapabilityService {

    private final VersionResolver resolver;

    public CapabilityService(VersionResolver resolver) {
        this.resolver = resolver;
    }

    public CapabilityReport getCapabilities(String family, String version) {
        return getCapabilities(FeatureFamily.fromId(family), version);
    }

    public CapabilityReport getCapabilities(FeatureFamily family, String version) {
        CapabilityMatrix m = resolver.forVersion(family, version).capabilities();
        return new CapabilityReport(m.version().label(), m.features());
    }

    /** Every registered family at one version. */
    public Map<FeatureFamily, CapabilityReport> getAll(String version) {
        Map<FeatureFamily, CapabilityReport> out = new EnumMap<>(FeatureFamily.class);
        for (FeatureFamily f : FeatureFamily.values()) {
            if (resolver.knows(f)) out.put(f, getCapabilities(f, version));
        }
        return out;
    }
}
