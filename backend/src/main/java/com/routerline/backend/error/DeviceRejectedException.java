package com.routerline.backend.error;

/**
 * The device answered and reported the batch as rejected. {@link #getDeviceError()} is the device's
 * own error text, unmodified.
 */
public class DeviceRejectedException extends RouterlineException {

    private final String deviceId;
    private final String deviceError;
    private final int instructionCount;

    public DeviceRejectedException(String deviceId, String deviceError, int instructionCount) {
        super(deviceError == null ? "" : deviceError);
        this.deviceId = deviceId;
        this.deviceError = deviceError;
        this.instructionCount = instructionCount;
    }

    public String getDeviceId() { return deviceId; }
    public String getDeviceError() { return deviceError; }
    public int getInstructionCount() { return instructionCount; }
}
