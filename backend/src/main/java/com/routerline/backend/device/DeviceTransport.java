package com.routerline.backend.device;

import com.routerline.backend.compiler.Instruction;

import java.util.List;

/**
 * One device's HTTP API. Implementations return the device's envelope as-is, including
 * {@code success=false}, and throw {@link com.routerline.backend.error.DeviceCommException} when no
 * envelope could be obtained.
 */
public interface DeviceTransport {

    DeviceResponse configure(List<Instruction> instructions);

    DeviceResponse showConfig(List<String> path);

    /** @param file target file on the device, or null for the boot config */
    DeviceResponse saveConfigFile(String file);
}
