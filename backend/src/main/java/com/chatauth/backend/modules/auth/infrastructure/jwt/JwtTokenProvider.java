package com.chatauth.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.chatauth.backend.global.config.AuthProperties;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

/**
 * HMAC key built from the configured secret's UTF-8 bytes, plus the HS256 implementation
 * able to use it.
 */
@Component
@DependsOn("authConfigurationValidator")
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;
    private final MacAlgorithm signingAlgorithm;

    public JwtTokenProvider(AuthProperties authProperties) {
        byte[] keyBytes = authProperties.secret().getBytes(StandardCharsets.UTF_8);
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);

        int keyBits = keyBytes.length * Byte.SIZE;
        if (keyBits < Jwts.SIG.HS256.getKeyBitLength()) {
            log.warn("auth.secret is {} bits, below the {} bits recommended for HS256; use a longer secret",
                    keyBits, Jwts.SIG.HS256.getKeyBitLength());
            this.signingAlgorithm = HmacSha256Algorithm.INSTANCE;
        } else {
            this.signingAlgorithm = Jwts.SIG.HS256;
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public MacAlgorithm getSigningAlgorithm() {
        return signingAlgorithm;
    }
}
