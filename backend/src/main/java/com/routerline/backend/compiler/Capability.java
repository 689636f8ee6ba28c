package com.routerline.backend.compiler;

public record Capability(boolean supported, String description) {}
