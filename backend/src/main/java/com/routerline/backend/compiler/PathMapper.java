package com.routerline.backend.compiler;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Stateless entry point: (family, operation, version, params) to path tokens.
 */
@Component
public class PathMapper {

    private final VersionResolver resolver;

    public PathMapper(VersionResolver resolver) {
        this.resolver = resolver;
    }

    public Path resolve(FeatureFamily family, String operation, String version, Map<String, String> params) {
        return resolver.forVersion(family, version).resolve(operation, params);
    }

    public List<Path> resolveAll(FeatureFamily family, String operation, String version, Map<String, String> params) {
        return resolver.forVersion(family, version).resolveAll(operation, params);
    }

    public List<Path> resolveDelete(FeatureFamily family, String operation, String version, Map<String, String> params) {
        return resolver.forVersion(family, version).resolveDelete(operation, params);
    }
}
