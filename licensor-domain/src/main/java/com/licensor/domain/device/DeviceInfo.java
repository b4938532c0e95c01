package com.licensor.domain.device;

/**
 * Client-reported description of a device. Every field is optional.
 */
public record DeviceInfo(
        String deviceName,
        String deviceType,
        String fingerprint,
        String osName,
        String osVersion,
        String appVersion
) {

    public static DeviceInfo empty() {
        return new DeviceInfo(null, null, null, null, null, null);
    }
}
