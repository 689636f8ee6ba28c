package com.routerline.backend.error;

import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.VersionTag;

/**
 * The requested feature does not exist on the resolved firmware version.
 */
public class CapabilityException extends RouterlineException {

    private final FeatureFamily family;
    private final VersionTag version;
    private final String operation;

    public CapabilityException(FeatureFamily family, VersionTag version, String operation, String message) {
        super(message);
        this.family = family;
        this.version = version;
        this.operation = operation;
    }

    public FeatureFamily getFamily() { return family; }
    public VersionTag getVersion() { return version; }
    public String getOperation() { return operation; }
}
