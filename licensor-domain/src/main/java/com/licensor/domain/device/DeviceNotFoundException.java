package com.licensor.domain.device;

import com.licensor.domain.DomainException;

import java.util.Map;

public final class DeviceNotFoundException extends DomainException {

    public DeviceNotFoundException(String deviceId) {
        super("DEVICE_NOT_FOUND", "Device not found", Map.of("device_id", deviceId));
    }
}
