package com.complyhub.accesscontrol.restriction;

import java.util.List;

/**
 * Device restriction.
 *
 * @param allowedDeviceTypes device types allowed, compared case-insensitively (empty = any)
 * @param requireTrustedDevice whether the device must have been registered as trusted
 */
public record DeviceRestrictionConfig(List<String> allowedDeviceTypes, boolean requireTrustedDevice)
        implements RestrictionConfig {

    public DeviceRestrictionConfig {
        allowedDeviceTypes = allowedDeviceTypes == null ? List.of() : List.copyOf(allowedDeviceTypes);
    }

    @Override
    public RestrictionType type() {
        return RestrictionType.DEVICE;
    }
}
