package com.routerline.backend.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.error.DeviceCommException;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Speaks the router HTTP API: form posts carrying a JSON {@code data} field and the API {@code key}.
 */
public class VyosHttpTransport implements DeviceTransport {

    private final RestClient rest;
    private final ObjectMapper om;
    private final String deviceId;
    private final String apiKey;

    public VyosHttpTransport(RestClient rest, ObjectMapper om, String deviceId, String apiKey) {
        this.rest = rest;
        this.om = om;
        this.deviceId = deviceId;
        this.apiKey = apiKey;
    }

    @Override
    public DeviceResponse configure(List<Instruction> instructions) {
        List<Map<String, Object>> ops = new ArrayList<>(instructions.size());
        for (Instruction i : instructions) {
            Map<String, Object> op = new LinkedHashMap<>();
            op.put("op", i.kind().wireName());
            op.put("path", i.wirePath());
            ops.add(op);
        }
        return post("/configure", ops);
    }

    @Override
    public DeviceResponse showConfig(List<String> path) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("op", "showConfig");
        data.put("path", path == null ? List.of() : path);
        return post("/retrieve", data);
    }

    @Override
    public DeviceResponse saveConfigFile(String file) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("op", "save");
        if (file != null && !file.isBlank()) data.put("file", file);
        return post("/config-file", data);
    }

    private DeviceResponse post(String endpoint, Object data) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("data", toJson(data));
        form.add("key", apiKey);

        String body;
        try {
            body = rest.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            // auth failures never reach the config session
            if (code == 401 || code == 403) {
                throw new DeviceCommException(deviceId, "device " + deviceId + " refused credentials (HTTP " + code + ")", e);
            }
            DeviceResponse envelope = parseOrNull(e.getResponseBodyAsString());
            if (envelope != null) return envelope;
            throw new DeviceCommException(deviceId, "device " + deviceId + " answered HTTP " + code + " on " + endpoint, e);
        } catch (ResourceAccessException e) {
            throw new DeviceCommException(deviceId, "device " + deviceId + " unreachable on " + endpoint + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new DeviceCommException(deviceId, "device " + deviceId + " request failed on " + endpoint + ": " + e.getMessage(), e);
        }

        DeviceResponse envelope = parseOrNull(body);
        if (envelope == null) {
            throw new DeviceCommException(deviceId, "device " + deviceId + " returned an unreadable response on " + endpoint);
        }
        return envelope;
    }

    private DeviceResponse parseOrNull(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = om.readTree(body);
            if (node == null || !node.isObject() || !node.has("success")) return null;
            return om.treeToValue(node, DeviceResponse.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String toJson(Object data) {
        try {
            return om.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode device payload", e);
        }
    }
}
