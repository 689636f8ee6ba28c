package com.routerline.backend.capability;

import com.routerline.backend.compiler.Capability;

import java.util.Map;

/**
 * What consumers see: {@code {"version": "1.5", "features": {flag: {supported, description}}}}.
 */
public record CapabilityReport(String version, Map<String, Capability> features) {}
