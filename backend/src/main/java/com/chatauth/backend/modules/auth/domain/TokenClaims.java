package com.chatauth.backend.modules.auth.domain;

/**
 * Payload of one signed token. Timestamps are UTC epoch seconds.
 */
public record TokenClaims(long id, String email, long issuedAt, long expiresAt) {

    public long lifetimeSeconds() {
        return expiresAt - issuedAt;
    }
}
