package com.routerline.backend.device;

@FunctionalInterface
public interface DeviceTransportFactory {

    DeviceTransport create(DeviceContext device);
}
