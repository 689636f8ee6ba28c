package com.routerline.backend.error;

/**
 * The device could not be reached, timed out, or answered with something that is not an API response.
 * Nothing about the intended change is known to have been applied.
 */
public class DeviceCommException extends RouterlineException {

    private final String deviceId;

    public DeviceCommException(String deviceId, String message) {
        super(message);
        this.deviceId = deviceId;
    }

    public DeviceCommException(String deviceId, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() { return deviceId; }
}
