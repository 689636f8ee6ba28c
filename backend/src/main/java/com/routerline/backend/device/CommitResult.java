package com.routerline.backend.device;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Outcome of an applied batch. Rejections are reported as
 * {@link com.routerline.backend.error.DeviceRejectedException} instead.
 */
public record CommitResult(
        String deviceId,
        int instructionCount,
        JsonNode data,          // whatever the device echoed back, may be null
        Instant committedAt
) {}
