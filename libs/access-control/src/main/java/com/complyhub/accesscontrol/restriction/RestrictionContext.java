package com.complyhub.accesscontrol.restriction;

import java.time.Instant;

/**
 * Request attributes that access restrictions are checked against. Every attribute is optional.
 *
 * @param ip            client address
 * @param country       resolved country code
 * @param state         resolved state or region code
 * @param deviceType    client device type (e.g., "DESKTOP", "MOBILE")
 * @param trustedDevice whether the device is registered as trusted; null = unknown
 * @param currentTime   evaluation time; null = the evaluator's clock
 */
public record RestrictionContext(
        String ip,
        String country,
        String state,
        String deviceType,
        Boolean trustedDevice,
        Instant currentTime) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasIp() {
        return ip != null && !ip.isBlank();
    }

    public boolean hasCountry() {
        return country != null && !country.isBlank();
    }

    public boolean hasDeviceType() {
        return deviceType != null && !deviceType.isBlank();
    }

    /** Builder for {@link RestrictionContext}. */
    public static final class Builder {
        private String ip;
        private String country;
        private String state;
        private String deviceType;
        private Boolean trustedDevice;
        private Instant currentTime;

        private Builder() {
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder deviceType(String deviceType) {
            this.deviceType = deviceType;
            return this;
        }

        public Builder trustedDevice(Boolean trustedDevice) {
            this.trustedDevice = trustedDevice;
            return this;
        }

        public Builder currentTime(Instant currentTime) {
            this.currentTime = currentTime;
            return this;
        }

        public RestrictionContext build() {
            return new RestrictionContext(ip, country, state, deviceType, trustedDevice, currentTime);
        }
    }
}
