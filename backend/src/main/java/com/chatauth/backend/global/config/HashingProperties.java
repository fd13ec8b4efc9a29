package com.chatauth.backend.global.config;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Argon2id cost parameters and the size of the pool that runs them.
 * Defaults match the Argon2 reference recommendation (m=19456 KiB, t=2, p=1).
 */
@Validated
@ConfigurationProperties(prefix = "auth.hashing")
public record HashingProperties(
        @DefaultValue("16") @Min(16) int saltLength,
        @DefaultValue("32") @Min(16) int hashLength,
        @DefaultValue("1") @Min(1) int parallelism,
        @DefaultValue("19456") @Min(8) int memoryKib,
        @DefaultValue("2") @Min(1) int iterations,
        @DefaultValue("4") @Min(1) int poolSize,
        @DefaultValue("200") @Min(0) int queueCapacity
) {
}
