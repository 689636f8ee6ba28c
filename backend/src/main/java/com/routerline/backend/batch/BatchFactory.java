package com.routerline.backend.batch;

import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.VersionResolver;
import com.routerline.backend.compiler.VersionTag;
import com.routerline.backend.device.DeviceContext;
import org.springframework.stereotype.Service;

/**
 * Hands out fresh builders bound to a device's firmware. Builders are never shared or reused.
 */
@Service
public class BatchFactory {

    private final VersionResolver resolver;

    public BatchFactory(VersionResolver resolver) {
        this.resolver = resolver;
    }

    public BatchBuilder open(FeatureFamily family, String rawVersion) {
        return new BatchBuilder(resolver.forVersion(family, rawVersion));
    }

    public BatchBuilder open(FeatureFamily family, VersionTag version) {
        return new BatchBuilder(resolver.forTag(family, version));
    }

    public BatchBuilder open(FeatureFamily family, DeviceContext device) {
        return open(family, device.version());
    }
}
