package com.licensor.domain.device;

import com.licensor.domain.DomainException;

import java.util.Map;

public final class DeviceLimitExceededException extends DomainException {

    private final int currentDevices;
    private final int maxDevices;

    public DeviceLimitExceededException(int currentDevices, int maxDevices) {
        super("DEVICE_LIMIT_EXCEEDED", "Device limit exceeded",
                Map.of("current_devices", currentDevices, "max_devices", maxDevices));
        this.currentDevices = currentDevices;
        this.maxDevices = maxDevices;
    }

    public int currentDevices() {
        return currentDevices;
    }

    public int maxDevices() {
        return maxDevices;
    }
}
