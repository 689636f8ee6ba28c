package com.routerline.backend.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.error.DeviceCommException;

import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable device: records every call and answers with whatever the test queued.
 */
public class FakeDeviceTransport implements DeviceTransport {

    private static final ObjectMapper OM = new ObjectMapper();

    public final List<List<Instruction>> configured = new ArrayList<>();
    public final List<String> savedFiles = new ArrayList<>();
    public int showConfigCalls = 0;

    public DeviceResponse configureResponse = ok(null);
    public DeviceResponse saveResponse = ok(null);
    public JsonNode config = json("{\"system\":{\"host-name\":\"r1\"}}");
    public boolean unreachable = false;

    @Override
    public DeviceResponse configure(List<Instruction> instructions) {
        if (unreachable) throw new DeviceCommException("fake", "connection refused");
        configured.add(List.copyOf(instructions));
        return configureResponse;
    }

    @Override
    public DeviceResponse showConfig(List<String> path) {
        if (unreachable) throw new DeviceCommException("fake", "connection refused");
        showConfigCalls++;
        return ok(config);
    }

    @Override
    public DeviceResponse saveConfigFile(String file) {
        if (unreachable) throw new DeviceCommException("fake", "connection refused");
        savedFiles.add(file);
        return saveResponse;
    }

    public static DeviceResponse ok(JsonNode data) {
        return new DeviceResponse(true, data, null);
    }

    public static DeviceResponse rejected(String error) {
        return new DeviceResponse(false, null, error);
    }

    public static JsonNode json(String s) {
        try {
            return OM.readTree(s);
        } catch (Exception e) {
            throw new IllegalArgumentException(s, e);
        }
    }
}
