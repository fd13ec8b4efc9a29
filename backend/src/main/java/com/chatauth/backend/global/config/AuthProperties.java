package com.chatauth.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Signing secret and token lifetimes. Bound once at startup and shared read-only.
 * Checked by {@link AuthConfigurationValidator} before any key is built from it.
 */
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        String secret,
        long accessExpiryHours,
        long refreshExpiryHours,
        long otpExpiryMinutes
) {

    @Override
    public String toString() {
        return "AuthProperties[secret=****"
                + ", accessExpiryHours=" + accessExpiryHours
                + ", refreshExpiryHours=" + refreshExpiryHours
                + ", otpExpiryMinutes=" + otpExpiryMinutes + "]";
    }
}
