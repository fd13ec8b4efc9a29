package com.chatauth.backend.global.config;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.chatauth.backend.global.error.ConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Rejects an auth configuration the token issuer could not honour on every request.
 * Runs when the bean is created, ahead of {@code JwtTokenProvider}, so a bad secret
 * aborts the boot with a {@link ConfigurationException}.
 */
@Component
public class AuthConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(AuthConfigurationValidator.class);

    private final AuthProperties authProperties;
    private final Clock clock;

    public AuthConfigurationValidator(AuthProperties authProperties, Clock clock) {
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void validateOnStartup() {
        validate();
        log.info("Auth configuration validated: {}", authProperties);
    }

    public void validate() {
        List<String> problems = new ArrayList<>();

        String secret = authProperties.secret();
        if (secret == null || secret.isBlank()) {
            problems.add("auth.secret must not be empty");
        }

        checkExpiry(problems, "auth.access-expiry-hours", authProperties.accessExpiryHours(), false);
        checkExpiry(problems, "auth.refresh-expiry-hours", authProperties.refreshExpiryHours(), false);
        checkExpiry(problems, "auth.otp-expiry-minutes", authProperties.otpExpiryMinutes(), true);

        if (!problems.isEmpty()) {
            log.error("Auth configuration rejected: {}", problems);
            throw new ConfigurationException(problems);
        }
    }

    private void checkExpiry(List<String> problems, String key, long amount, boolean minutes) {
        if (amount <= 0) {
            problems.add(key + " must be positive");
            return;
        }
        try {
            Duration lifetime = minutes ? Duration.ofMinutes(amount) : Duration.ofHours(amount);
            // tokens carry millisecond Dates internally, so the expiry must fit there too
            clock.instant().plus(lifetime).toEpochMilli();
        } catch (ArithmeticException | DateTimeException ex) {
            problems.add(key + " overflows the token timestamp range");
        }
    }
}
