package com.chatauth.backend.modules.auth.domain;

/**
 * The slice of a stored user that token issuance needs.
 */
public record UserProjection(long id, String email) {

    public UserProjection {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
    }
}
