package com.routerline.backend.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope every device API call answers with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceResponse(boolean success, JsonNode data, String error) {}
