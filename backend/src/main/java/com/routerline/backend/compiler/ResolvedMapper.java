package com.routerline.backend.compiler;

import com.routerline.backend.error.CapabilityException;
import com.routerline.backend.error.UnknownOperationException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A feature grammar bound to one firmware version. Lookups try the version overrides first and fall
 * back to the shared base. Read-only after construction and shared by concurrent requests.
 */
public final class ResolvedMapper {

    private final FeatureFamily family;
    private final VersionTag version;
    private final Map<String, OperationSpec> overrides;
    private final Map<String, OperationSpec> base;
    private final CapabilityMatrix capabilities;

    public ResolvedMapper(FeatureFamily family,
                          VersionTag version,
                          Map<String, OperationSpec> overrides,
                          Map<String, OperationSpec> base,
                          CapabilityMatrix capabilities) {
        this.family = family;
        this.version = version;
        this.overrides = Map.copyOf(overrides);
        this.base = Map.copyOf(base);
        this.capabilities = capabilities;
    }

    public FeatureFamily family() { return family; }
    public VersionTag version() { return version; }
    public CapabilityMatrix capabilities() { return capabilities; }

    /**
     * Resolves a single-path operation. Returns {@link Path#EMPTY} when the field does not exist at
     * this version.
     */
    public Path resolve(String operation, Map<String, String> params) {
        List<Path> paths = resolveAll(operation, params);
        if (paths.size() != 1) {
            throw new IllegalArgumentException(operation + " resolves to " + paths.size() + " paths; use resolveAll");
        }
        return paths.get(0);
    }

    /** Set paths in the order the device needs them. */
    public List<Path> resolveAll(String operation, Map<String, String> params) {
        OperationSpec spec = available(operation);
        if (spec == null) return List.of(Path.EMPTY);
        return spec.setPaths(params);
    }

    public List<Path> resolveDelete(String operation, Map<String, String> params) {
        OperationSpec spec = available(operation);
        if (spec == null) return List.of(Path.EMPTY);
        return spec.deletePaths(params);
    }

    public OperationSpec spec(String operation) {
        OperationSpec spec = overrides.get(operation);
        if (spec == null) spec = base.get(operation);
        if (spec == null) {
            throw new UnknownOperationException(operation,
                    "Unknown operation '" + operation + "' for " + family.id());
        }
        return spec;
    }

    public boolean supports(String operation) {
        OperationSpec spec = overrides.getOrDefault(operation, base.get(operation));
        return spec != null && spec.availability() == OperationSpec.Availability.AVAILABLE;
    }

    public Set<String> operationNames() {
        Set<String> names = new TreeSet<>(base.keySet());
        names.addAll(overrides.keySet());
        return names;
    }

    // null means "absent at this version, skip"
    private OperationSpec available(String operation) {
        OperationSpec spec = spec(operation);
        return switch (spec.availability()) {
            case AVAILABLE -> spec;
            case ABSENT -> null;
            case UNSUPPORTED -> throw new CapabilityException(family, version, operation,
                    spec.reason() + ". Current device is running v" + version.label());
        };
    }
}
